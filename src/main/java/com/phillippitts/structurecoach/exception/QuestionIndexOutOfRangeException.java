package com.phillippitts.structurecoach.exception;

/**
 * Thrown when a question index falls outside {@code [0, questionCount)} for a practice session.
 */
public class QuestionIndexOutOfRangeException extends StructureCoachException {

    private final int questionIndex;
    private final int questionCount;

    public QuestionIndexOutOfRangeException(int questionIndex, int questionCount) {
        super("Question index " + questionIndex + " out of range; valid range is 0.."
                + Math.max(0, questionCount - 1));
        this.questionIndex = questionIndex;
        this.questionCount = questionCount;
    }

    public int getQuestionIndex() {
        return questionIndex;
    }

    public int getQuestionCount() {
        return questionCount;
    }
}
