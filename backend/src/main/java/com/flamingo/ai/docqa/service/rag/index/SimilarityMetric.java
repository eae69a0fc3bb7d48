package com.flamingo.ai.docqa.service.rag.index;

/** Similarity between two vectors. Higher scores always mean more similar. */
public enum SimilarityMetric {

  /** Cosine similarity in [-1, 1]; 0 when either vector has zero length. */
  COSINE {
    @Override
    public double score(float[] a, float[] b) {
      double dot = 0;
      double normA = 0;
      double normB = 0;
      for (int i = 0; i < a.length; i++) {
        dot += a[i] * b[i];
        normA += a[i] * a[i];
        normB += b[i] * b[i];
      }
      if (normA == 0 || normB == 0) {
        return 0.0;
      }
      return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
  },

  /** {@code 1 / (1 + euclideanDistance)}, in (0, 1]. */
  INVERSE_DISTANCE {
    @Override
    public double score(float[] a, float[] b) {
      double sum = 0;
      for (int i = 0; i < a.length; i++) {
        double d = a[i] - b[i];
        sum += d * d;
      }
      return 1.0 / (1.0 + Math.sqrt(sum));
    }
  };

  /** Scores two vectors of equal length. */
  public abstract double score(float[] a, float[] b);
}
