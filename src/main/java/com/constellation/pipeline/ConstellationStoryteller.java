package com.constellation.pipeline;

/**
 * Generative text collaborator: names the constellation, tells its story and describes its
 * features in free text that {@link com.constellation.scoring.FeatureTextParser} understands.
 */
public interface ConstellationStoryteller {

    String name(String keyword);

    String story(String name, String keyword);

    String describeFeatures(String name, String story);
}
