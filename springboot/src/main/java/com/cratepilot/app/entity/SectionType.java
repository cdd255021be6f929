package com.cratepilot.app.entity;

public enum SectionType {
    INTRO,
    VERSE,
    CHORUS,
    BUILDUP,
    DROP,
    BREAKDOWN,
    OUTRO,
    OTHER
}
