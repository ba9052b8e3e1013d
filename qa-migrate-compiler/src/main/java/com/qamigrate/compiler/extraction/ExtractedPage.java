package com.qamigrate.compiler.extraction;

/**
 * A page-object class found in one source file.
 */
public record ExtractedPage(String id, String name, String filePath) {}
