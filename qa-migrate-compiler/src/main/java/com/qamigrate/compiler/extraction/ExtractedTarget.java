package com.qamigrate.compiler.extraction;

/**
 * A page or locator normalized into the shape the target builder consumes.
 * Locators without an owning declaration are named after their node id.
 */
public record ExtractedTarget(
    String type,
    String name,
    String nodeId,
    String strategy,
    String locatorValue,
    String pageName,
    String filePath
) {
    public static final String TYPE_PAGE = "page";
    public static final String TYPE_LOCATOR = "locator";

    public static ExtractedTarget fromPage(ExtractedPage page) {
        return new ExtractedTarget(TYPE_PAGE, page.name(), page.id(), null, null, null, page.filePath());
    }

    public static ExtractedTarget fromLocator(ExtractedLocator locator) {
        String name = locator.name() != null ? locator.name() : locator.id();
        return new ExtractedTarget(TYPE_LOCATOR, name, locator.id(), locator.strategy(),
                locator.locatorValue(), locator.pageName(), locator.filePath());
    }

    public boolean isLocator() {
        return TYPE_LOCATOR.equals(type);
    }
}
