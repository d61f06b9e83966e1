package com.project.sketch.scoring.DTOs;

public record ReferenceImage(String id, String name, String url) {}
