package com.example.plancompiler.api.v1.dto;

import java.util.List;

public record ProgramListResponse(List<ProgramListItem> programs) {}
