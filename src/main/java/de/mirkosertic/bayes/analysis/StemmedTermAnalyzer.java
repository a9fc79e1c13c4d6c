package de.mirkosertic.bayes.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer producing the terms the classifier counts.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> StopFilter
 * -> LengthFilter(min, max) -> SnowballFilter(languageName)}</p>
 *
 * <p>Stop words and short tokens are removed before stemming, so "is", "and" or "i" never
 * reach a category table. Folding runs first, which makes "Müller" and "muller" the same term.
 * Supported language names are the Snowball stemmer names accepted by {@link SnowballFilter},
 * for example {@code "English"} or {@code "German"}.</p>
 */
public class StemmedTermAnalyzer extends Analyzer {

    public static final int DEFAULT_MIN_TERM_LENGTH = 3;
    public static final int DEFAULT_MAX_TERM_LENGTH = 255;

    private final String languageName;
    private final CharArraySet stopWords;
    private final int minTermLength;
    private final int maxTermLength;

    /**
     * @param languageName  the Snowball stemmer language name
     * @param stopWords     terms to drop before stemming, matched after folding
     * @param minTermLength shortest token kept
     * @param maxTermLength longest token kept
     */
    public StemmedTermAnalyzer(final String languageName, final CharArraySet stopWords,
                               final int minTermLength, final int maxTermLength) {
        if (minTermLength < 1 || maxTermLength < minTermLength) {
            throw new IllegalArgumentException("Invalid term length range [" + minTermLength + ", " + maxTermLength + "]");
        }
        this.languageName = languageName;
        this.stopWords = CharArraySet.unmodifiableSet(stopWords);
        this.minTermLength = minTermLength;
        this.maxTermLength = maxTermLength;
    }

    /**
     * English stemming with the Lucene English stop word set.
     */
    public static StemmedTermAnalyzer english() {
        return new StemmedTermAnalyzer("English", EnglishAnalyzer.ENGLISH_STOP_WORDS_SET,
                DEFAULT_MIN_TERM_LENGTH, DEFAULT_MAX_TERM_LENGTH);
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        if (!stopWords.isEmpty()) {
            stream = new StopFilter(stream, stopWords);
        }
        stream = new LengthFilter(stream, minTermLength, maxTermLength);
        stream = new SnowballFilter(stream, languageName);
        return new TokenStreamComponents(tokenizer, stream);
    }

    public String getLanguageName() {
        return languageName;
    }
}
