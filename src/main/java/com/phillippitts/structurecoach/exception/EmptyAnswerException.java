package com.phillippitts.structurecoach.exception;

/**
 * Thrown when there is no answer text to work with: either no sections have been submitted
 * for a question yet, or a submitted/transcribed answer is blank.
 */
public class EmptyAnswerException extends StructureCoachException {

    private final long practiceId;
    private final int questionIndex;

    public EmptyAnswerException(long practiceId, int questionIndex) {
        super("No sections submitted yet for practice " + practiceId + ", question " + questionIndex);
        this.practiceId = practiceId;
        this.questionIndex = questionIndex;
    }

    public EmptyAnswerException(long practiceId, int questionIndex, String reason) {
        super(reason + " (practice " + practiceId + ", question " + questionIndex + ")");
        this.practiceId = practiceId;
        this.questionIndex = questionIndex;
    }

    public long getPracticeId() {
        return practiceId;
    }

    public int getQuestionIndex() {
        return questionIndex;
    }
}
