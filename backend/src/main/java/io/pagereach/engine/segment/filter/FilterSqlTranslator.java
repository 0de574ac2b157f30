package io.pagereach.engine.segment.filter;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Translates a filter tree into a parameterized SQL predicate over the {@code contacts} table
 * aliased {@code c}. Each condition goes to the handler owning its field: base columns, tags, or
 * custom fields. The predicate matches exactly the contacts {@link FilterEvaluator} would match at
 * the same instant.
 */
@Component
public class FilterSqlTranslator {

  private final ColumnFilterHandler columnFilterHandler;
  private final TagFilterHandler tagFilterHandler;
  private final CustomFieldFilterHandler customFieldFilterHandler;

  public FilterSqlTranslator(
      ColumnFilterHandler columnFilterHandler,
      TagFilterHandler tagFilterHandler,
      CustomFieldFilterHandler customFieldFilterHandler) {
    this.columnFilterHandler = columnFilterHandler;
    this.tagFilterHandler = tagFilterHandler;
    this.customFieldFilterHandler = customFieldFilterHandler;
  }

  /**
   * Builds the WHERE predicate for a filter tree.
   *
   * @param root the filter tree; null matches every contact
   * @param params output map receiving the named parameter bindings
   * @param now evaluation instant for relative date operators and the messaging window
   * @return predicate without a leading WHERE keyword, never empty
   */
  public String buildWhereClause(FilterGroup root, Map<String, Object> params, Instant now) {
    if (root == null) {
      return OperatorPredicates.TRUE;
    }
    return root.accept(new SqlBuilder(new FilterSqlContext(params, now)));
  }

  private final class SqlBuilder implements FilterVisitor<String> {

    private final FilterSqlContext context;

    private SqlBuilder(FilterSqlContext context) {
      this.context = context;
    }

    @Override
    public String visitGroup(FilterGroup group) {
      String combined;
      if (group.children().isEmpty()) {
        combined = OperatorPredicates.TRUE;
      } else {
        String joiner = group.logic() == FilterLogic.OR ? " OR " : " AND ";
        combined =
            group.children().stream()
                .map(child -> child.accept(this))
                .collect(Collectors.joining(joiner, "(", ")"));
      }
      return group.negate() ? OperatorPredicates.not(combined) : combined;
    }

    @Override
    public String visitCondition(FilterCondition condition) {
      String predicate;
      if (columnFilterHandler.supports(condition.field())) {
        predicate = columnFilterHandler.buildPredicate(condition, context);
      } else if (tagFilterHandler.supports(condition.field())) {
        predicate = tagFilterHandler.buildPredicate(condition, context);
      } else {
        predicate = customFieldFilterHandler.buildPredicate(condition, context);
      }
      return condition.not() ? OperatorPredicates.not(predicate) : predicate;
    }
  }
}
