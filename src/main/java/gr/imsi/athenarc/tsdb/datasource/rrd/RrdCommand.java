package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.QueryType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An rrdtool invocation kept as separate tokens: the sub-command, its options
 * ({@code --start 1685314800}) and its positional arguments
 * ({@code DEF:v1=...}, {@code XPORT:v1:value}).
 */
public class RrdCommand implements CompiledQuery {

    private final String name;
    private final List<String> options;
    private final List<String> arguments;
    private final QueryType type;
    private final List<String> requestedFields;

    public RrdCommand(String name, List<String> options, List<String> arguments,
                      QueryType type, List<String> requestedFields) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.options = ImmutableList.copyOf(options);
        this.arguments = ImmutableList.copyOf(arguments);
        this.type = Preconditions.checkNotNull(type, "type");
        this.requestedFields = ImmutableList.copyOf(requestedFields);
    }

    public RrdCommand(String name, List<String> options, List<String> arguments) {
        this(name, options, arguments, QueryType.DATA, ImmutableList.of());
    }

    /**
     * Escapes {@code \} and {@code :} so a path, data source name or legend can
     * sit inside a colon separated {@code DEF}/{@code XPORT} statement.
     */
    public static String escape(String part) {
        StringBuilder escaped = new StringBuilder(part.length());
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == '\\' || c == ':') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    public String getName() {
        return name;
    }

    public List<String> getOptions() {
        return options;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /**
     * Fields the caller asked for; the xport parser narrows the legend to them.
     */
    public List<String> getRequestedFields() {
        return requestedFields;
    }

    /**
     * The full argument vector, sub-command first.
     */
    public List<String> toArgs() {
        List<String> args = new ArrayList<>(1 + options.size() + arguments.size());
        args.add(name);
        args.addAll(options);
        args.addAll(arguments);
        return args;
    }

    @Override
    public QueryType getType() {
        return type;
    }

    @Override
    public String getRawQuery() {
        return toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RrdCommand)) return false;
        RrdCommand that = (RrdCommand) o;
        return name.equals(that.name) && options.equals(that.options)
            && arguments.equals(that.arguments) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, options, arguments, type);
    }

    @Override
    public String toString() {
        return String.join(" ", toArgs());
    }
}
