package com.flamingo.ai.museumguide.service.rag.sparse;

import com.flamingo.ai.museumguide.service.rag.chunking.CjkText;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.cn.smart.SmartChineseAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

/**
 * Word tokenizer for mixed Chinese / Latin text.
 *
 * <p>The text is cut into script runs: CJK runs go through Lucene's {@link SmartChineseAnalyzer}
 * (dictionary word segmentation), everything else through {@link StandardAnalyzer} (lowercased
 * word tokens). Both analyzers are thread-safe.
 */
@Component
public class TextTokenizer {

  private static final String FIELD = "content";

  private final Analyzer latinAnalyzer = new StandardAnalyzer();
  private final Analyzer chineseAnalyzer = new SmartChineseAnalyzer();

  /**
   * Tokenizes text into lowercased word tokens in reading order.
   *
   * @param text any text
   * @return tokens, empty for blank text
   */
  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }
    StringBuilder run = new StringBuilder();
    boolean runIsCjk = false;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      boolean cjk = CjkText.isCjk(cp);
      if (run.length() > 0 && cjk != runIsCjk && Character.isLetterOrDigit(cp)) {
        analyze(runIsCjk ? chineseAnalyzer : latinAnalyzer, run.toString(), tokens);
        run.setLength(0);
      }
      if (run.length() == 0 || Character.isLetterOrDigit(cp)) {
        runIsCjk = cjk;
      }
      run.appendCodePoint(cp);
      i += Character.charCount(cp);
    }
    if (run.length() > 0) {
      analyze(runIsCjk ? chineseAnalyzer : latinAnalyzer, run.toString(), tokens);
    }
    return tokens;
  }

  /**
   * Tokenizes text and expands the tokens to all n-grams from 1 to {@code ngramMax}; n-gram parts
   * are joined with a single space.
   *
   * @param text any text
   * @param ngramMax largest n-gram order (1 for unigrams only)
   * @return terms in reading order, unigrams first for each position
   */
  public List<String> terms(String text, int ngramMax) {
    List<String> tokens = tokenize(text);
    List<String> terms = new ArrayList<>(tokens.size() * Math.max(1, ngramMax));
    for (int i = 0; i < tokens.size(); i++) {
      StringBuilder gram = new StringBuilder();
      for (int n = 1; n <= ngramMax && i + n <= tokens.size(); n++) {
        if (n > 1) {
          gram.append(' ');
        }
        gram.append(tokens.get(i + n - 1));
        terms.add(gram.toString());
      }
    }
    return terms;
  }

  private static void analyze(Analyzer analyzer, String text, List<String> sink) {
    try (TokenStream tokenStream = analyzer.tokenStream(FIELD, text)) {
      CharTermAttribute attr = tokenStream.addAttribute(CharTermAttribute.class);
      tokenStream.reset();
      while (tokenStream.incrementToken()) {
        String token = attr.toString();
        if (!token.isBlank()) {
          sink.add(token);
        }
      }
      tokenStream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to tokenize text", e);
    }
  }

  @PreDestroy
  public void close() {
    latinAnalyzer.close();
    chineseAnalyzer.close();
  }
}
