package io.pagereach.engine.segment.filter;

/**
 * A SQL expression standing for one contact value, typed so operators can reproduce the in-memory
 * comparison rules: numbers and instants are recognised in text the way {@link FilterEvaluator}
 * parses them. Fragments avoid braces, which native query parsing reserves.
 */
record SqlOperand(Kind kind, String sql) {

  enum Kind {
    TEXT,
    BOOLEAN,
    TIMESTAMP,
    JSON
  }

  private static final String NUMBER_PATTERN =
      "'^\\s*[-+]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][-+]?[0-9]+)?\\s*$'";
  private static final String DATE = "[0-9][0-9][0-9][0-9]-[0-9][0-9]-[0-9][0-9]";
  private static final String DATE_PATTERN = "'^\\s*" + DATE + "\\s*$'";
  private static final String INSTANT_PATTERN =
      "'^\\s*"
          + DATE
          + "T[0-9][0-9]:[0-9][0-9]:[0-9][0-9](\\.[0-9]+)?(Z|[+-][0-9][0-9]:[0-9][0-9])\\s*$'";

  static SqlOperand text(String sql) {
    return new SqlOperand(Kind.TEXT, sql);
  }

  static SqlOperand bool(String sql) {
    return new SqlOperand(Kind.BOOLEAN, sql);
  }

  static SqlOperand timestamp(String sql) {
    return new SqlOperand(Kind.TIMESTAMP, sql);
  }

  static SqlOperand json(String sql) {
    return new SqlOperand(Kind.JSON, sql);
  }

  /** The value as text; JSON strings are unquoted, instants are rendered as ISO-8601 UTC. */
  String asText() {
    return switch (kind) {
      case TEXT -> sql;
      case BOOLEAN -> "CAST(" + sql + " AS text)";
      case TIMESTAMP -> "to_char(" + sql + " AT TIME ZONE 'UTC', 'YYYY-MM-DD\"T\"HH24:MI:SS\"Z\"')";
      case JSON -> "(jsonb_build_array(" + sql + ") ->> 0)";
    };
  }

  String isNull() {
    if (kind == Kind.JSON) {
      return "(" + sql + " IS NULL OR jsonb_typeof(" + sql + ") = 'null')";
    }
    return "(" + sql + " IS NULL)";
  }

  /** True when the value is a boolean; case is ignored when comparing booleans as text. */
  String isBoolean() {
    return switch (kind) {
      case BOOLEAN -> "TRUE";
      case JSON -> "(jsonb_typeof(" + sql + ") = 'boolean')";
      case TEXT, TIMESTAMP -> "FALSE";
    };
  }

  /** The value as a double, or NULL when it is neither a number nor a numeric string. */
  String asNumber() {
    if (kind == Kind.BOOLEAN || kind == Kind.TIMESTAMP) {
      return "CAST(NULL AS double precision)";
    }
    String text = asText();
    return "(CASE WHEN "
        + text
        + " ~ "
        + NUMBER_PATTERN
        + " THEN CAST("
        + text
        + " AS double precision) END)";
  }

  /** The value as an instant, or NULL when it is neither a timestamp nor an ISO date string. */
  String asInstant() {
    return switch (kind) {
      case TIMESTAMP -> sql;
      case BOOLEAN -> "CAST(NULL AS timestamptz)";
      case TEXT, JSON -> {
        String text = asText();
        yield "(CASE WHEN "
            + text
            + " ~ "
            + DATE_PATTERN
            + " THEN CAST(CAST(btrim("
            + text
            + ") AS date) AS timestamp) AT TIME ZONE 'UTC' WHEN "
            + text
            + " ~ "
            + INSTANT_PATTERN
            + " THEN CAST(btrim("
            + text
            + ") AS timestamptz) END)";
      }
    };
  }
}
