package com.gt.recall.model;

public enum SessionState {
    Empty,
    Ready,
    Presenting,
    Ended
}
