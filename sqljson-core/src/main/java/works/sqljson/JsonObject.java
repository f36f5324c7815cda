package works.sqljson;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ordered sequence of members.
 * <p>
 * Member order is preserved exactly as given.
 * Keys are not checked for uniqueness; that's the producer's business.
 */
public record JsonObject(List<Member> members) implements JsonValue {
	public JsonObject {
		members = List.copyOf(members);
	}

	public static JsonObject of(List<Member> members) {
		return new JsonObject(members);
	}

	public static JsonObject empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public JsonType type() {
		return JsonType.OBJECT;
	}

	public record Member(String key, JsonValue value) {
		public Member {
			requireNonNull(key);
			requireNonNull(value);
		}
	}

	public static final class Builder {
		private final List<Member> members = new ArrayList<>();

		private Builder() { }

		public Builder add(String key, JsonValue value) {
			members.add(new Member(key, value));
			return this;
		}

		public JsonObject build() {
			return new JsonObject(members);
		}
	}

	private static final JsonObject EMPTY = new JsonObject(List.of());
}
