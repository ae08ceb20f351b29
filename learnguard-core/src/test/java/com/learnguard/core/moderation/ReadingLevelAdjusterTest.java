package com.learnguard.core.moderation;

import com.learnguard.common.model.LearnerProfile;
import org.junit.jupiter.api.Test;

import static com.learnguard.core.support.TestRequests.learner;
import static org.junit.jupiter.api.Assertions.*;

class ReadingLevelAdjusterTest {

    private final ReadingLevelAdjuster adjuster = new ReadingLevelAdjuster();

    @Test
    void youngLearnersGetSimplerWords() {
        String adjusted = adjuster.adjust("Scientists utilize models to examine molecular structures.", learner(10));

        assertEquals("Scientists use models to look at simple structures.", adjusted);
    }

    @Test
    void middleSchoolersGetFoundationalWording() {
        String adjusted = adjuster.adjust("These are the basic ideas of atomic theory.", learner(14));

        assertEquals("These are the foundational ideas of atomic theory.", adjusted);
    }

    @Test
    void gradeIsUsedWhenAgeIsUnknown() {
        LearnerProfile fourthGrader = LearnerProfile.builder().userId("s").gradeLevel("4").build();
        LearnerProfile seventhGrader = LearnerProfile.builder().userId("s").gradeLevel("7").build();

        assertEquals(ReadingLevelAdjuster.Level.ELEMENTARY, adjuster.levelFor(fourthGrader));
        assertEquals(ReadingLevelAdjuster.Level.MIDDLE, adjuster.levelFor(seventhGrader));
    }

    @Test
    void adultsAndUnknownLearnersAreUntouched() {
        String text = "We utilize basic quantum ideas.";

        assertEquals(text, adjuster.adjust(text, learner(17)));
        assertEquals(text, adjuster.adjust(text, null));
    }
}
