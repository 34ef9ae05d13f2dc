package org.pywalrus.transpiler;

import java.util.Collection;

/**
 * Source text of the declarations inserted in front of converted code.
 */
final class WrapperTemplates {

    private static final String PREFIX = "_walrus_wrapper_";

    private static final String FUNCTION_DOC = "\"\"\"Wrapper function for assignment expression.\"\"\"";
    private static final String LAMBDA_DOC = "\"\"\"Wrapper function for lambda definitions.\"\"\"";

    private WrapperTemplates() {
    }

    static String functionName(String name, String uid) {
        return PREFIX + name + "_" + uid;
    }

    static String lambdaName(String uid) {
        return PREFIX + "lambda_" + uid;
    }

    /**
     * <pre>
     * if False:
     *     name = NotImplemented
     * </pre>
     */
    static String hiddenBindings(Collection<String> names, String indentation, String unit, String linesep) {
        StringBuilder text = new StringBuilder();
        text.append(indentation).append("if False:").append(linesep);
        for (String name : names) {
            text.append(indentation).append(unit).append(name).append(" = NotImplemented").append(linesep);
        }
        return text.toString();
    }

    static String wrapperFunction(WrapperFunction function, String indentation, String unit, String linesep) {
        String name = function.name();
        String parameter = "expr".equals(name) ? "value" : "expr";
        String body = indentation + unit;
        return indentation + "def " + function.functionName() + "(" + parameter + "):" + linesep
                + body + FUNCTION_DOC + linesep
                + body + function.keyword().getKeyword() + " " + name + linesep
                + body + name + " = " + parameter + linesep
                + body + "return " + name + linesep;
    }

    static String lambdaFunction(LambdaFunction function, String indentation, String unit, String linesep) {
        return indentation + "def " + function.functionName() + "(" + function.parameters() + "):" + linesep
                + indentation + unit + LAMBDA_DOC + linesep
                + function.body();
    }

    /**
     * Stores the value in the class namespace, then reads it back by name so that the
     * expression still yields it.
     */
    static String classStorage(String mangledName, String name, String expression) {
        return "(__import__('builtins').locals().__setitem__('" + mangledName + "', " + expression + "), "
                + name + ")[1]";
    }
}
