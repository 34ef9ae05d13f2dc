package org.pywalrus.transpiler;

/**
 * A pending named function standing in for a lambda.
 *
 * @param parameters the lambda's parameter list, already converted
 * @param body       indented body lines ending with the {@code return} statement
 */
public record LambdaFunction(String uid, String parameters, String body) {

    public String functionName() {
        return WrapperTemplates.lambdaName(uid);
    }
}
