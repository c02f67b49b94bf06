package com.gt.recall.model;

public enum AdvanceStatus {
    Presenting,
    Failed,
    Exhausted
}
