package com.gt.recall.model;

public record ReviewedItem(Item item, RecallRating rating) { }
