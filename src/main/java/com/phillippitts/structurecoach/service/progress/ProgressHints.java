package com.phillippitts.structurecoach.service.progress;

/**
 * Encouragement text placed in front of the next section's base hint.
 */
final class ProgressHints {

    private ProgressHints() {}

    static String encouragement(int sectionsComplete, String nextSection) {
        return switch (sectionsComplete) {
            case 0 -> "Let's begin with " + nextSection + ". ";
            case 1 -> "Great start! Now move to " + nextSection + ". ";
            case 2 -> "Good progress! Next is " + nextSection + ". ";
            case 3 -> "You're more than halfway there! Now explain " + nextSection + ". ";
            default -> "Almost done! Time for " + nextSection + ". ";
        };
    }

    static String completion(String frameworkName) {
        return "Excellent! You've completed all sections of the " + frameworkName
                + " framework. Your answer is ready for analysis.";
    }

    static String inProgress(int sectionsComplete, int totalSections) {
        return sectionsComplete + " of " + totalSections + " sections submitted";
    }
}
