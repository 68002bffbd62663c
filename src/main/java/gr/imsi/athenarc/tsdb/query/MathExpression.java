package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.Preconditions;

/**
 * A backend-native arithmetic fragment, passed through to the compiled query
 * as written, and the column it produces.
 */
public final class MathExpression {

    private final String expression;
    private final String alias;

    public MathExpression(String expression, String alias) {
        this.expression = Preconditions.checkNotNull(expression, "expression");
        this.alias = Preconditions.checkNotNull(alias, "alias");
    }

    public String getExpression() {
        return expression;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }
}
