package com.leanplan.expression;

import com.leanplan.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Expression representing a scalar function call such as {@code sin(a)} or {@code log(a)}.
 *
 * <p>The result type is fixed by the caller; the math functions built by
 * {@link com.leanplan.logical.ColumnFunctions} all return float64.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @param dataType the return data type
     */
    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public String render(Function<String, String> columnRenderer) {
        return arguments.stream()
            .map(arg -> arg.render(columnRenderer))
            .collect(Collectors.joining(", ", functionName + "(", ")"));
    }

    @Override
    public String toString() {
        return render(Function.identity());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) &&
               arguments.equals(that.arguments) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType);
    }
}
