package com.flamingo.ai.museumguide.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval and orchestration pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Sparse sparse = new Sparse();
  private Retrieval retrieval = new Retrieval();
  private Session session = new Session();
  private Orchestration orchestration = new Orchestration();
  private Streaming streaming = new Streaming();
  private Tone tone = new Tone();
  private VisionContext visionContext = new VisionContext();
  private Index index = new Index();
  private VectorStore vectorStore = new VectorStore();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 500;
    private int overlap = 100;

    /** Share of CJK letters above which a chunk is tagged {@code zh}. */
    private double cjkRatioThreshold = 0.3;
  }

  @Getter
  @Setter
  public static class Sparse {
    private int maxFeatures = 1000;
    private double maxDfRatio = 0.95;
    private int minDf = 1;
    private int ngramMax = 2;

    /** A single-chunk corpus would lose every term to the max-df ratio, so it is exempt. */
    private int minChunksForDfPruning = 2;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 10;
    private int overFetchFactor = 2;
    private double denseWeight = 0.7;
    private double sparseWeight = 0.3;
    private int maxContextChars = 2500;
    private boolean excludeQaPairsForQuestions = true;
  }

  @Getter
  @Setter
  public static class Session {
    private int maxHistoryMessages = 40;
  }

  @Getter
  @Setter
  public static class Orchestration {
    private long contextFetchTimeoutMs = 5000;
    private long generationTimeoutMs = 120000;
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 100;
  }

  /** Caller-facing pool that serves SSE responses. */
  @Getter
  @Setter
  public static class Streaming {
    private int corePoolSize = 5;
    private int maxPoolSize = 20;
    private int queueCapacity = 50;
    private long timeoutMs = 120000;
  }

  @Getter
  @Setter
  public static class Tone {
    /** Chance (0-100) that a follow-up rewrite references the visitor's appearance. */
    private int appearanceReferencePercentage = 70;
  }

  @Getter
  @Setter
  public static class VisionContext {
    private boolean enabled = true;
    private String baseUrl = "http://localhost:5004";
  }

  @Getter
  @Setter
  public static class Index {
    private String corpusPath = "data/corpus";
    private boolean buildOnStartup = false;
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** Either {@code in-memory} or {@code elasticsearch}. */
    private String type = "in-memory";

    private String indexPrefix = "museum-guide-chunks";
    private int dimensions = 1024;
  }
}
