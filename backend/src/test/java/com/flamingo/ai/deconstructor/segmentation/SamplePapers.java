package com.flamingo.ai.deconstructor.segmentation;

/** Synthetic paper texts shared by segmentation, service and report tests. */
public final class SamplePapers {

  /**
   * A small well-formed paper. Normalized line indexes: title block 0-2, abstract heading 3,
   * introduction 6, method 9, results 11, conclusion 13, references 15; 17 lines in total.
   */
  public static final String WELL_FORMED =
      String.join(
          "\n",
          "Deep Learning for X",
          "Jane Doe, John Smith",
          "jane@example.com",
          "",
          "Abstract",
          "We study sparse graphs. In this work, we propose a novel method for Y.",
          "Experiments confirm the gains.",
          "",
          "1 Introduction",
          "Graphs are everywhere. Prior methods scale poorly.",
          "Sparse inputs make this worse.",
          "",
          "2 Method",
          "Our method routes messages through widgets.",
          "",
          "3 Results",
          "Widgets improve accuracy by 4 points.",
          "",
          "4 Conclusion",
          "Widgets are a simple fix for sparse graphs.",
          "",
          "References",
          "[1] A. Author. Widgets. 2020.");

  public static final String CONTRIBUTION_SENTENCE =
      "In this work, we propose a novel method for Y.";

  /** Plain notes without any recognizable heading or contribution cue. */
  public static final String NO_HEADINGS =
      String.join(
          "\n", "Some notes on widgets", "They are small.", "They are useful in many settings.");

  private SamplePapers() {}
}
