package com.examparse.core.model;

import lombok.Value;

import java.util.List;

@Value
public class MergeResult {
    List<Question> questions;
    int matchedCount;
}
