package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchSignal;
import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.fingerprint.FingerprintEngine;
import com.contact.resolution.similarity.BlockingKeyStrategy;
import com.contact.resolution.similarity.JaroWinklerSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Match Detector Tests")
class MatchDetectorTest {

    private final FingerprintEngine engine = new FingerprintEngine();

    private static ContactRecord.Builder contact(String id, String first, String last) {
        return ContactRecord.builder().id(id).firstName(first).lastName(last);
    }

    @Nested
    @DisplayName("Exact email")
    class ExactEmailTests {
        private final ExactEmailDetector detector = new ExactEmailDetector();

        @Test
        @DisplayName("Emails are compared case-insensitively and trimmed")
        void caseInsensitive() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").email("Jane@Example.com").build(),
                    contact("b", "J", "D").email(" jane@example.com ").build(),
                    contact("c", "Other", "Person").email("other@example.com").build()));

            assertEquals(1, signals.size());
            assertEquals(MatchType.EMAIL, signals.get(0).matchType());
            assertEquals("jane@example.com", signals.get(0).matchValue());
            assertEquals(List.of("a", "b"), signals.get(0).contactIds());
        }

        @Test
        @DisplayName("A contact repeating its own email is not a duplicate of itself")
        void ownDuplicateIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").email("jane@example.com").email("JANE@example.com").build()));
            assertTrue(signals.isEmpty());
        }

        @Test
        @DisplayName("Empty emails are never evidence")
        void emptyEmailsIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").email("").build(),
                    contact("b", "John", "Roe").email("  ").build()));
            assertTrue(signals.isEmpty());
        }

        @Test
        @DisplayName("Three contacts sharing one address yield one signal")
        void threeWayGroup() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "A", "A").email("x@y.com").build(),
                    contact("b", "B", "B").email("x@y.com").build(),
                    contact("c", "C", "C").email("X@Y.COM").build()));
            assertEquals(1, signals.size());
            assertEquals(3, signals.get(0).contactIds().size());
        }

        @Test
        @DisplayName("Empty input yields no signals")
        void emptyInput() {
            assertTrue(detector.detect(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Exact phone")
    class ExactPhoneTests {
        private final ExactPhoneDetector detector = new ExactPhoneDetector(engine);

        @Test
        @DisplayName("Formatting and the +1 prefix do not prevent a match")
        void formattingIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").phone("+1 (555) 123-4567", "mobile").build(),
                    contact("b", "Jane", "Doe").phone("555.123.4567", "work").build()));

            assertEquals(1, signals.size());
            assertEquals("5551234567", signals.get(0).matchValue());
            assertEquals(MatchType.PHONE, signals.get(0).matchType());
        }

        @Test
        @DisplayName("Numbers without digits are never evidence")
        void noDigitsIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").phone("n/a", null).build(),
                    contact("b", "John", "Roe").phone("n/a", null).build()));
            assertTrue(signals.isEmpty());
        }
    }

    @Nested
    @DisplayName("Birthday and name")
    class BirthdayNameTests {
        private final BirthdayNameDetector detector = new BirthdayNameDetector("2001-01-01");

        @Test
        @DisplayName("Year is ignored, month and day must agree")
        void yearIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").birthday("1985-03-14").build(),
                    contact("b", "jane", "DOE").birthday("2020-03-14").build(),
                    contact("c", "Jane", "Doe").birthday("1985-03-15").build()));

            assertEquals(1, signals.size());
            assertEquals("jane doe (birthday: 03-14)", signals.get(0).matchValue());
            assertEquals(List.of("a", "b"), signals.get(0).contactIds());
        }

        @Test
        @DisplayName("Same person entered in two different years matches")
        void differentYearsMatch() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Melissa", "Conklin").birthday("2022-02-28").build(),
                    contact("b", "Melissa", "Conklin").birthday("2023-02-28").build()));
            assertEquals(1, signals.size());
        }

        @Test
        @DisplayName("Placeholder birthday is never evidence")
        void placeholderIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").birthday("2001-01-01").build(),
                    contact("b", "Jane", "Doe").birthday("2001-01-01T00:00:00").build()));
            assertTrue(signals.isEmpty());
        }

        @Test
        @DisplayName("Malformed birthdays are skipped without failing the pass")
        void malformedSkipped() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").birthday("not-a-date").build(),
                    contact("b", "Jane", "Doe").birthday("1990-07-04").build(),
                    contact("c", "Jane", "Doe").birthday("1991-07-04T12:00:00Z").build()));
            assertEquals(1, signals.size());
            assertEquals(List.of("b", "c"), signals.get(0).contactIds());
        }

        @Test
        @DisplayName("Month and day are compared as written, even when the date does not exist")
        void impossibleDateStillGroups() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").birthday("2023-02-30").build(),
                    contact("b", "Jane", "Doe").birthday("1999-02-30").build()));

            assertEquals(1, signals.size());
            assertEquals("jane doe (birthday: 02-30)", signals.get(0).matchValue());
        }

        @Test
        @DisplayName("Missing names or birthday are never evidence")
        void missingFieldsIgnored() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", null).birthday("1990-07-04").build(),
                    contact("b", "Jane", null).birthday("1990-07-04").build(),
                    contact("c", "Jane", "Doe").build(),
                    contact("d", "Jane", "Doe").build()));
            assertTrue(signals.isEmpty());
        }
    }

    @Nested
    @DisplayName("Fingerprint name")
    class FingerprintNameTests {
        private final FingerprintNameDetector detector = new FingerprintNameDetector(engine);

        @Test
        @DisplayName("Accented and swapped names share a fingerprint")
        void accentsAndOrder() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "José", "García").build(),
                    contact("b", "Jose", "Garcia").build(),
                    contact("c", "Garcia", "Jose").build()));

            assertEquals(1, signals.size());
            MatchSignal signal = signals.get(0);
            assertEquals(List.of("a", "b", "c"), signal.contactIds());
            assertTrue(signal.matchValue().startsWith("garcia jose ("));
            assertTrue(signal.matchValue().contains("José García"));
        }

        @Test
        @DisplayName("Swapped names match by fingerprint but not by name and title")
        void swappedNames() {
            List<ContactRecord> contacts = List.of(
                    contact("c1", "Tom", "Cruise").jobTitle("Actor").build(),
                    contact("c2", "Cruise", "Tom").jobTitle("Producer").build());

            assertEquals(List.of("c1", "c2"), detector.detect(contacts).get(0).contactIds());
            assertTrue(new NameTitleDetector().detect(contacts).isEmpty());
        }

        @Test
        @DisplayName("Names in other scripts are romanized, not dropped")
        void nonLatinSurnamesKeepTheirTokens() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Ivan", "Петров").build(),
                    contact("b", "Ivan", "Сидоров").build(),
                    contact("c", "Иван", "Петров").build()));

            assertEquals(1, signals.size());
            assertEquals(List.of("a", "c"), signals.get(0).contactIds());
            assertTrue(signals.get(0).matchValue().startsWith("ivan petrov ("));
        }

        @Test
        @DisplayName("Contacts missing a name part are skipped")
        void missingPartSkipped() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "").build(),
                    contact("b", "Jane", null).build()));
            assertTrue(signals.isEmpty());
        }
    }

    @Nested
    @DisplayName("Name and title")
    class NameTitleTests {
        private final NameTitleDetector detector = new NameTitleDetector();

        @Test
        void sameNameAndTitleMatch() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").jobTitle("CTO").build(),
                    contact("b", " jane ", "doe").jobTitle("cto ").build(),
                    contact("c", "Jane", "Doe").jobTitle("CEO").build()));

            assertEquals(1, signals.size());
            assertEquals("jane doe | cto", signals.get(0).matchValue());
        }

        @Test
        void missingTitleIsNeverEvidence() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").build(),
                    contact("b", "Jane", "Doe").jobTitle("").build()));
            assertTrue(signals.isEmpty());
        }
    }

    @Nested
    @DisplayName("LinkedIn")
    class LinkedInTests {
        private final LinkedInDetector detector = new LinkedInDetector(engine);

        @Test
        void urlVariantsMatch() {
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").linkedin("https://www.linkedin.com/in/JaneDoe/").build(),
                    contact("b", "J", "Doe").linkedin("linkedin.com/in/janedoe?trk=profile").build(),
                    contact("c", "X", "Y").linkedin("https://twitter.com/janedoe").build(),
                    contact("d", "X", "Z").linkedin("https://twitter.com/janedoe").build()));

            assertEquals(1, signals.size());
            assertEquals("linkedin.com/in/janedoe", signals.get(0).matchValue());
            assertEquals(List.of("a", "b"), signals.get(0).contactIds());
        }
    }

    @Nested
    @DisplayName("Fuzzy name")
    @ExtendWith(MockitoExtension.class)
    class FuzzyNameTests {

        @Mock
        private BlockingKeyStrategy blockingKeyStrategy;

        @Test
        @DisplayName("Similar names in the same surname block produce a pair signal")
        void similarNamesMatch() {
            FuzzyNameDetector detector = new FuzzyNameDetector(0.9);
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jonathan", "Smith").build(),
                    contact("b", "Jonathon", "Smith").build(),
                    contact("c", "Mary", "Smith").build()));

            assertEquals(1, signals.size());
            assertEquals("Jonathan Smith <-> Jonathon Smith (0.97)", signals.get(0).matchValue());
            assertEquals(List.of("a", "b"), signals.get(0).contactIds());
        }

        @Test
        @DisplayName("A shared surname block alone is not enough")
        void sharedBlockDifferentName() {
            FuzzyNameDetector detector = new FuzzyNameDetector(0.9);
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jonathan", "Smith").build(),
                    contact("b", "David", "Smith").build()));
            assertTrue(signals.isEmpty());
        }

        @Test
        @DisplayName("Names below the threshold do not match")
        void thresholdApplies() {
            FuzzyNameDetector detector = new FuzzyNameDetector(0.98);
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jonathan", "Smith").build(),
                    contact("b", "Jonathon", "Smith").build()));
            assertTrue(signals.isEmpty());
        }

        @Test
        @DisplayName("Each matching pair in a block is its own signal")
        void pairwiseSignals() {
            FuzzyNameDetector detector = new FuzzyNameDetector(0.9);
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").build(),
                    contact("b", "Jane", "Doe").build(),
                    contact("c", "Jane", "Doe").build()));
            assertEquals(3, signals.size());
        }

        @Test
        @DisplayName("Contacts in different blocks are never compared")
        void blocksSeparateComparisons() {
            when(blockingKeyStrategy.blockingKey(anyString())).thenAnswer(inv -> inv.getArgument(0));
            JaroWinklerSimilarity similarity = spy(new JaroWinklerSimilarity());
            FuzzyNameDetector detector = new FuzzyNameDetector(0.5, blockingKeyStrategy, similarity);

            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "Jane", "Doe").build(),
                    contact("b", "Jane", "Doe ").build(),
                    contact("c", "Jane", "Dole").build()));

            assertEquals(1, signals.size());
            assertEquals(List.of("a", "b"), signals.get(0).contactIds());
            verify(similarity, times(1)).compute(anyString(), anyString());
        }

        @Test
        @DisplayName("Blank names are skipped")
        void blankNamesSkipped() {
            FuzzyNameDetector detector = new FuzzyNameDetector(0.5);
            List<MatchSignal> signals = detector.detect(List.of(
                    contact("a", "  ", "Doe").build(),
                    contact("b", " ", "Doe").build(),
                    contact("c", "Jane", null).build()));
            assertTrue(signals.isEmpty());
        }

        @Test
        @DisplayName("Threshold outside [0, 1] is rejected")
        void rejectsBadThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new FuzzyNameDetector(1.5));
        }
    }
}
