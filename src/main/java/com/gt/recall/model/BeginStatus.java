package com.gt.recall.model;

public enum BeginStatus {
    Started,
    AlreadyActive,
    NothingDue,
    ModeUnavailable
}
