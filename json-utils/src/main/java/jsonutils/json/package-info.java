/// Provides a line-aware JSON parser that builds an in-memory tree.
///
/// ## Parsing JSON documents
/// `Json.parse` reads a whole document and returns its root `JsonNode`, which
/// may be of any kind. Each node records the 1-based line on which it began.
/// The first grammar violation aborts the parse with an `InvalidJsonException`
/// that carries the line of the violation; there is no column information and
/// no partial result.
///
/// ## Accepted grammar
/// The accepted grammar is a strict subset of RFC 8259 with a few documented
/// departures:
/// - after a member's colon the value must start with one of `" { [ 0-9 t f n`,
///   so a negative number cannot be an object member value;
/// - carriage returns, line feeds and tabs are skipped everywhere, including
///   inside string literals, and spaces are skipped outside string literals;
/// - numbers match `-?[0-9]*(\.[0-9]+)?([eE][-+]?[0-9]+)?`, so leading zeros
///   and a missing integer part (`.5`) are accepted.
///
/// ## Duplicate keys
/// A repeated object key does not fail the parse. The first value is kept and
/// the line of every later occurrence is recorded; see `JsonObject`.
///
/// @see <a href="https://datatracker.ietf.org/doc/html/rfc8259">RFC 8259</a>
package jsonutils.json;
