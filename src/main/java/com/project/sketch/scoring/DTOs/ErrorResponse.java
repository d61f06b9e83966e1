package com.project.sketch.scoring.DTOs;

public record ErrorResponse(String error, String details) {}
