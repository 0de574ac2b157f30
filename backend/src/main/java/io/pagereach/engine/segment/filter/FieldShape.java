package io.pagereach.engine.segment.filter;

import java.util.function.Function;

/** How a handler's field looks to operators: a single value, a list, or either. */
interface FieldShape {

  /** Predicate that holds when some value of the field passes {@code test}. */
  String anyElement(Function<SqlOperand, String> test, FilterSqlContext context);

  String isEmpty();

  /** Operand for operators that read the field as a whole; null when that never matches. */
  SqlOperand whole();

  static FieldShape scalar(SqlOperand operand) {
    return new FieldShape() {
      @Override
      public String anyElement(Function<SqlOperand, String> test, FilterSqlContext context) {
        return test.apply(operand);
      }

      @Override
      public String isEmpty() {
        return switch (operand.kind()) {
          case TEXT -> "(" + operand.sql() + " IS NULL OR " + operand.sql() + " ~ '^\\s*$')";
          case BOOLEAN, TIMESTAMP, JSON -> operand.isNull();
        };
      }

      @Override
      public SqlOperand whole() {
        return operand;
      }
    };
  }
}
