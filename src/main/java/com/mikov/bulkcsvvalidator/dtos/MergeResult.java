package com.mikov.bulkcsvvalidator.dtos;

import com.mikov.bulkcsvvalidator.model.JobStats;

import java.util.List;

public record MergeResult(List<String> header, List<List<String>> rows, JobStats stats) {
}
