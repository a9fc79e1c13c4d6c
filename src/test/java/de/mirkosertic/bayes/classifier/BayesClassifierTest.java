package de.mirkosertic.bayes.classifier;

import de.mirkosertic.bayes.analysis.WhitespaceTermTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BayesClassifier")
class BayesClassifierTest {

    private static final double EPSILON = 1e-12;

    private final WhitespaceTermTokenizer tokenizer = new WhitespaceTermTokenizer();
    private BayesClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = BayesClassifier.create(List.of("a", "b"), tokenizer);
    }

    private long categorySum(final String term) {
        long sum = 0;
        for (final Category category : classifier.getCategories()) {
            sum += category.countTerm(term);
        }
        return sum;
    }

    private void assertCorpusMatchesCategories() {
        final Set<String> terms = new HashSet<>(classifier.getTermFrequencies().keySet());
        for (final Category category : classifier.getCategories()) {
            terms.addAll(category.getTermFrequencies().keySet());
        }
        for (final String term : terms) {
            assertThat(classifier.countTerm(term)).as("count of '%s'", term).isEqualTo(categorySum(term));
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Empty category set is rejected")
        void emptyCategoriesRejected() {
            assertThatThrownBy(() -> BayesClassifier.create(List.of(), tokenizer))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Blank category names are rejected")
        void blankNameRejected() {
            assertThatThrownBy(() -> BayesClassifier.create(List.of("a", " "), tokenizer))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Duplicate names collapse and declaration order is kept")
        void duplicatesCollapse() {
            final BayesClassifier c = BayesClassifier.create(List.of("z", "a", "z", "m"), tokenizer);

            assertThat(c.getCategoryNames()).containsExactly("z", "a", "m");
        }

        @Test
        @DisplayName("Default probability outside (0, 1] is rejected")
        void invalidDefaultProbability() {
            assertThatThrownBy(() -> new BayesClassifier(List.of("a"), tokenizer, TieBreakPolicy.LAST_ON_TIE, 0.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new BayesClassifier(List.of("a"), tokenizer, TieBreakPolicy.LAST_ON_TIE, 1.5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new BayesClassifier(List.of("a"), tokenizer, TieBreakPolicy.LAST_ON_TIE, Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Training")
    class Training {

        @Test
        @DisplayName("Terms never trained count as zero and get the default likelihood")
        void zeroCountDefault() {
            classifier.train("a", "x y");

            assertThat(classifier.countTerm("never")).isZero();
            for (final Category category : classifier.getCategories()) {
                assertThat(category.termLikelihood("never", 0.05)).isEqualTo(0.05);
            }
        }

        @Test
        @DisplayName("Training the same text twice doubles every count")
        void accumulation() {
            classifier.train("a", "x y y");
            final long x = classifier.countTerm("x");
            final long y = classifier.countTerm("y");

            classifier.train("a", "x y y");

            assertThat(classifier.countTerm("x")).isEqualTo(2 * x);
            assertThat(classifier.countTerm("y")).isEqualTo(2 * y);
            assertThat(classifier.getCategory("a").countTerm("y")).isEqualTo(4);
        }

        @Test
        @DisplayName("Train followed by untrain restores previous counts")
        void untrainRestores() {
            classifier.train("a", "x z");
            classifier.train("a", "x x y");
            classifier.untrain("a", "x x y");

            assertThat(classifier.countTerm("x")).isEqualTo(1);
            assertThat(classifier.countTerm("y")).isZero();
            assertThat(classifier.countTerm("z")).isEqualTo(1);
            assertThat(classifier.getCategory("a").countTerm("x")).isEqualTo(1);
        }

        @Test
        @DisplayName("Untrain at zero count is a no-op and never goes negative")
        void untrainAtZero() {
            classifier.train("a", "x");
            classifier.untrain("a", "x");
            classifier.untrain("a", "x x");

            assertThat(classifier.countTerm("x")).isZero();
            assertThat(classifier.getCategory("a").countTerm("x")).isZero();
            assertThat(classifier.countTerms()).isZero();
        }

        @Test
        @DisplayName("Untraining terms never seen leaves the corpus untouched")
        void untrainUnseenTerms() {
            classifier.train("a", "x");
            classifier.untrain("a", "ghost");
            classifier.untrain("b", "x");

            assertThat(classifier.countUniqueTerms()).isEqualTo(1);
            assertThat(classifier.countTerm("x")).isEqualTo(1);
            assertThat(classifier.getCategory("b").countUniqueTerms()).isZero();
        }

        @Test
        @DisplayName("Unique term count keeps terms untrained down to zero")
        void uniqueTermsKeepClampedKeys() {
            classifier.train("a", "x y");
            classifier.untrain("a", "x y");

            assertThat(classifier.countTerms()).isZero();
            assertThat(classifier.countUniqueTerms()).isEqualTo(2);
        }

        @Test
        @DisplayName("Corpus counts always equal the sum over categories")
        void corpusMatchesCategories() {
            classifier.train("a", "x");
            classifier.train("b", "x x y");
            assertCorpusMatchesCategories();

            // more than category a holds, b's share must survive
            classifier.untrain("a", "x x x");
            assertCorpusMatchesCategories();
            assertThat(classifier.countTerm("x")).isEqualTo(2);

            classifier.train("a", "y z z");
            classifier.untrain("b", "y q");
            classifier.train("b", "z");
            classifier.untrain("a", "z");
            assertCorpusMatchesCategories();
            assertThat(classifier.countTerms()).isEqualTo(5);
        }

        @Test
        @DisplayName("Empty text changes nothing")
        void emptyTextIsNoOp() {
            classifier.train("a", "");
            classifier.untrain("a", "");

            assertThat(classifier.countTerms()).isZero();
            assertThat(classifier.countUniqueTerms()).isZero();
        }

        @Test
        @DisplayName("Unknown category fails and changes nothing")
        void unknownCategory() {
            classifier.train("a", "x");

            assertThatThrownBy(() -> classifier.train("nonexistent_category", "text"))
                    .isInstanceOf(UnknownCategoryException.class)
                    .hasMessageContaining("nonexistent_category");
            assertThatThrownBy(() -> classifier.untrain("nonexistent_category", "x"))
                    .isInstanceOf(UnknownCategoryException.class);

            assertThat(classifier.countTerm("text")).isZero();
            assertThat(classifier.countTerm("x")).isEqualTo(1);
            assertThat(classifier.countUniqueTerms()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown category exception lists the declared categories")
        void unknownCategoryDetails() {
            assertThatThrownBy(() -> classifier.getCategory("c"))
                    .isInstanceOfSatisfying(UnknownCategoryException.class, e -> {
                        assertThat(e.getCategoryName()).isEqualTo("c");
                        assertThat(e.getKnownCategories()).containsExactly("a", "b");
                    });
        }
    }

    @Nested
    @DisplayName("Classification")
    class Scoring {

        @Test
        @DisplayName("Plain scores are prior times likelihood in declaration order")
        void plainScores() {
            classifier.train("a", "x y z");
            classifier.train("b", "x");

            final List<Classification> scores = classifier.classifications("y");

            assertThat(scores).extracting(Classification::categoryName).containsExactly("a", "b");
            assertThat(scores.get(0).score()).isCloseTo(0.75 / 3, within(EPSILON));
            assertThat(scores.get(1).score()).isCloseTo(0.25 * 0.05, within(EPSILON));
        }

        @Test
        @DisplayName("Log scores are log prior plus log likelihood")
        void logScores() {
            classifier.train("a", "x y z");
            classifier.train("b", "x");

            final List<Classification> scores = classifier.logClassifications("y", 0.1);

            assertThat(scores.get(0).score()).isCloseTo(Math.log(0.75) + Math.log(1.0 / 3), within(EPSILON));
            assertThat(scores.get(1).score()).isCloseTo(Math.log(0.25) + Math.log(0.1), within(EPSILON));
            assertThat(classifier.classify("y")).isEqualTo("a");
        }

        @Test
        @DisplayName("classify picks the maximum of the log scores")
        void decisionConsistency() {
            classifier.train("a", "apple banana");
            classifier.train("b", "cherry");

            for (final String text : List.of("apple apple cherry", "cherry cherry", "banana", "unknown words")) {
                final List<Classification> scores = classifier.logClassifications(text);
                final Classification max = scores.get(0).score() > scores.get(1).score() ? scores.get(0) : scores.get(1);
                assertThat(classifier.classify(text)).as(text).isEqualTo(max.categoryName());
            }
        }

        @Test
        @DisplayName("classify and the score lists use the same configured default probability")
        void decisionConsistencyWithConfiguredDefault() {
            final BayesClassifier c = new BayesClassifier(List.of("a", "b"), tokenizer, TieBreakPolicy.LAST_ON_TIE, 0.5);
            c.train("a", "x");
            c.train("b", "y y y y y y y y y");

            final List<Classification> scores = c.logClassifications("x");

            // a: log(0.1) + log(1), b: log(0.9) + log(0.5); with 0.05 instead of 0.5, a would win
            assertThat(scores.get(0).score()).isCloseTo(Math.log(0.1), within(EPSILON));
            assertThat(scores.get(1).score()).isCloseTo(Math.log(0.9) + Math.log(0.5), within(EPSILON));
            assertThat(c.classify("x")).isEqualTo("b");
            assertThat(c.classify("x", BayesClassifier.DEFAULT_PROBABILITY)).isEqualTo("a");
            assertThat(c.classifications("x").get(1).score()).isCloseTo(0.9 * 0.5, within(EPSILON));
        }

        @Test
        @DisplayName("Plain and log scores rank categories the same way")
        void monotonicTransform() {
            classifier.train("a", "apple banana");
            classifier.train("b", "cherry");

            for (final String text : List.of("apple apple cherry", "cherry cherry", "banana")) {
                final List<Classification> plain = classifier.classifications(text);
                final List<Classification> logs = classifier.logClassifications(text);

                assertThat(Integer.signum(Double.compare(plain.get(0).score(), plain.get(1).score())))
                        .as(text)
                        .isEqualTo(Integer.signum(Double.compare(logs.get(0).score(), logs.get(1).score())));
            }
        }

        @Test
        @DisplayName("Identically trained categories tie and the later declared one wins")
        void lastOnTie() {
            final BayesClassifier c = BayesClassifier.create(new LinkedHashSet<>(List.of("first", "second")), tokenizer);
            c.train("first", "same words here");
            c.train("second", "same words here");

            assertThat(c.classify("same words")).isEqualTo("second");
            assertThat(c.classify("nothing known")).isEqualTo("second");
        }

        @Test
        @DisplayName("FIRST_ON_TIE lets the earlier declared category win a tie")
        void firstOnTie() {
            final BayesClassifier c = new BayesClassifier(List.of("first", "second"), tokenizer,
                    TieBreakPolicy.FIRST_ON_TIE, BayesClassifier.DEFAULT_PROBABILITY);
            c.train("first", "same words here");
            c.train("second", "same words here");

            assertThat(c.classify("same words")).isEqualTo("first");
        }

        @Test
        @DisplayName("A category without training scores negative infinity and loses")
        void negativeInfinityCategories() {
            final BayesClassifier c = BayesClassifier.create(List.of("trained", "empty"), tokenizer);
            c.train("trained", "x");

            assertThat(c.logClassifications("x").get(1).score()).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat(c.classify("x")).isEqualTo("trained");
        }

        @Test
        @DisplayName("Text sharing no term with any category falls back to the larger prior")
        void unseenTextFollowsPrior() {
            classifier.train("a", "x y z");
            classifier.train("b", "w");

            assertThat(classifier.classify("nothing in common")).isEqualTo("a");
        }

        @Test
        @DisplayName("Long texts underflow in plain space but still classify in log space")
        void longTextClassifies() {
            classifier.train("a", "ruby rails");
            classifier.train("b", "money stuff");
            final String longText = String.join(" ", Collections.nCopies(400, "rails unseen"));

            assertThat(classifier.classifications(longText)).allSatisfy(s -> assertThat(s.score()).isZero());
            assertThat(classifier.classify(longText)).isEqualTo("a");
        }

        @Test
        @DisplayName("Classifying before any training fails with an undefined prior")
        void undefinedPrior() {
            assertThatThrownBy(() -> classifier.classify("anything")).isInstanceOf(UndefinedPriorException.class);
            assertThatThrownBy(() -> classifier.classifications("anything")).isInstanceOf(UndefinedPriorException.class);
        }

        @Test
        @DisplayName("Classifying after everything was untrained fails with an undefined prior")
        void undefinedPriorAfterUntrain() {
            classifier.train("a", "x");
            classifier.untrain("a", "x");

            assertThatThrownBy(() -> classifier.classify("x")).isInstanceOf(UndefinedPriorException.class);
        }

        @Test
        @DisplayName("Invalid default probability per call is rejected")
        void invalidDefaultProbabilityPerCall() {
            classifier.train("a", "x");

            assertThatThrownBy(() -> classifier.logClassifications("x", -0.1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> classifier.classify("x", 0.0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
