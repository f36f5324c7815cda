/**
 * Exceptions thrown when JSON input can't be turned into a value tree.
 */
package works.sqljson.exceptions;
