package im.arun.provisiongraph.classify;

public enum BlockType {
    TITLE,
    CHAPTER_TITLE,
    SECTION_TITLE,
    ARTICLE_TITLE,
    ANNEX_TITLE,
    TABLE,
    PARAGRAPH;

    public boolean isHeading() {
        return this != TABLE && this != PARAGRAPH;
    }
}
