package com.gt.recall.model;

public record SessionProgress(int current, int total, int correct, int incorrect) { }
