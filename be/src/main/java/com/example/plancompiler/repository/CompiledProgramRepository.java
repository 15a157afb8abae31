package com.example.plancompiler.repository;

import com.example.plancompiler.domain.CompiledProgram;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CompiledProgramRepository extends JpaRepository<CompiledProgram, UUID> {

    List<CompiledProgram> findAllByOrderByCreatedAtDesc();

    List<CompiledProgram> findByName(String name);
}
