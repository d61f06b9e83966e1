package com.project.sketch.scoring.DTOs;

public record DifficultyInfo(String id, String label, String description) {}
