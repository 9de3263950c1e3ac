package jsonutils.lint;

/// One repeated occurrence of an object key.
///
/// @param pointer JSON Pointer to the object holding the key (`""` for the root)
/// @param key the repeated key
/// @param firstLine line on which the retained value began
/// @param line line on which the repeated key appeared
record DuplicateKey(String pointer, String key, int firstLine, int line) {}
