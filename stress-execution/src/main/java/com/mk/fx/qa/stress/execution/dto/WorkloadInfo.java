package com.mk.fx.qa.stress.execution.dto;

/** One selectable catalog entry. */
public record WorkloadInfo(int id, String name) {}
