package com.example.stlabels.model;

/**
 * Текущая секция сканера.
 */
public enum Section {
    NONE,
    GLOBAL,
    LOCAL
}
