package de.mirkosertic.bayes.classifier;

import de.mirkosertic.bayes.analysis.AnalyzerTermTokenizer;
import de.mirkosertic.bayes.analysis.StemmedTermAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end classification with the stemming analyzer chain.
 */
@DisplayName("BayesClassifier with stemmed English terms")
class BayesClassifierScenarioTest {

    private AnalyzerTermTokenizer tokenizer;
    private BayesClassifier classifier;

    @BeforeEach
    void setUp() {
        tokenizer = new AnalyzerTermTokenizer(StemmedTermAnalyzer.english());
        classifier = BayesClassifier.create(List.of("interesting", "uninteresting"), tokenizer);
        classifier.train("interesting", "here is some interesting text about Ruby and rails");
        classifier.train("uninteresting", "here is some text about financial stuff");
    }

    @AfterEach
    void tearDown() {
        tokenizer.close();
    }

    @Test
    @DisplayName("Text about rails is interesting")
    void railsIsInteresting() {
        assertThat(classifier.classify("i love rails")).isEqualTo("interesting");
        assertThat(classifier.classify("Ruby on Rails")).isEqualTo("interesting");
    }

    @Test
    @DisplayName("Text about finance is uninteresting")
    void financeIsUninteresting() {
        assertThat(classifier.classify("i hate financial stuff")).isEqualTo("uninteresting");
        assertThat(classifier.classify("Finances and more stuff")).isEqualTo("uninteresting");
    }

    @Test
    @DisplayName("Text sharing no stem with either corpus is decided by the prior alone")
    void unrelatedTextFollowsPrior() {
        // "hate" and "tax" occur in neither corpus, so both likelihoods are 0.05^2
        final List<Classification> scores = classifier.logClassifications("i hate taxes");

        assertThat(scores.get(0).score() - scores.get(1).score()).isCloseTo(Math.log(7.0 / 6.0), within(1e-12));
        assertThat(classifier.classify("i hate taxes")).isEqualTo("interesting");
    }

    @Test
    @DisplayName("Stemming maps inflected forms onto the trained terms")
    void stemmedCounts() {
        assertThat(classifier.countTerm("rail")).isEqualTo(1);
        assertThat(classifier.countTerm("rails")).isZero();
        assertThat(classifier.countTerm("text")).isEqualTo(2);
        // stop words never reach the tables
        assertThat(classifier.countTerm("is")).isZero();
        assertThat(classifier.countTerm("and")).isZero();
    }

    @Test
    @DisplayName("Untraining a text removes its stemmed terms again")
    void untrainRoundTrip() {
        final long before = classifier.countTerms();

        classifier.train("interesting", "Rails routing");
        classifier.untrain("interesting", "rails routing");

        assertThat(classifier.countTerms()).isEqualTo(before);
        assertThat(classifier.countTerm("rail")).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown category and untrained classifier fail explicitly")
    void failures() {
        assertThatThrownBy(() -> classifier.train("nonexistent_category", "text"))
                .isInstanceOf(UnknownCategoryException.class);

        final BayesClassifier fresh = BayesClassifier.create(List.of("interesting", "uninteresting"), tokenizer);
        assertThatThrownBy(() -> fresh.classify("i love rails")).isInstanceOf(UndefinedPriorException.class);
    }

    @Test
    void defaultFactoryUsesEnglishStemming() {
        final BayesClassifier stemming = BayesClassifier.create(List.of("interesting", "uninteresting"));
        stemming.train("interesting", "Ruby on Rails");

        assertThat(stemming.countTerm("rail")).isEqualTo(1);
        assertThat(stemming.countTerm("rubi")).isEqualTo(1);
        assertThat(stemming.classify("rails")).isEqualTo("interesting");
    }
}
