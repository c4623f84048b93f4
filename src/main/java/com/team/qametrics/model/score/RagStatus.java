package com.team.qametrics.model.score;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Backlog 健康度的紅黃綠三態。
 */
@Getter
@RequiredArgsConstructor
public enum RagStatus {
    GREEN("Healthy", "#22c55e"),
    AMBER("Needs Attention", "#f59e0b"),
    RED("Critical", "#ef4444");

    private final String label;
    private final String color;
}
