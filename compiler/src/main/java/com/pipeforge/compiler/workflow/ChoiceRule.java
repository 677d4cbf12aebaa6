package com.pipeforge.compiler.workflow;

/**
 * One entry of a Choice state's "Choices" array.
 *
 * @param operand the comparison value; for IS_PRESENT the boolean to test
 */
public record ChoiceRule(String variable, Operator operator, Object operand, BranchTarget next) {

    public enum Operator {
        STRING_EQUALS("StringEquals"),
        IS_PRESENT("IsPresent");

        private final String field;

        Operator(String field) { this.field = field; }

        public String field() { return field; }
    }

    public static ChoiceRule stringEquals(String variable, String value, BranchTarget next) {
        return new ChoiceRule(variable, Operator.STRING_EQUALS, value, next);
    }

    public static ChoiceRule isPresent(String variable, BranchTarget next) {
        return new ChoiceRule(variable, Operator.IS_PRESENT, Boolean.TRUE, next);
    }

    public ChoiceRule withNext(BranchTarget next) {
        return new ChoiceRule(variable, operator, operand, next);
    }
}
