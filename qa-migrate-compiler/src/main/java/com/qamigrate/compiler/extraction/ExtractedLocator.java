package com.qamigrate.compiler.extraction;

/**
 * A {@code By.<strategy>(...)} locator found in one source file.
 *
 * @param id           id of the locator-constructor node
 * @param name         declaration owning the locator, or {@code null} for inline locators
 * @param strategy     locator strategy as written, e.g. {@code cssSelector}
 * @param locatorValue first literal argument, or {@code null} when not a literal
 * @param filePath     source file
 * @param pageName     enclosing class, or {@code null}
 */
public record ExtractedLocator(
    String id,
    String name,
    String strategy,
    String locatorValue,
    String filePath,
    String pageName
) {}
