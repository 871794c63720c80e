package com.diskmap.treemap.model;

import lombok.Value;

import java.util.List;

/**
 * Legend entry for one category.
 */
@Value
public class CategoryInfo {

    FileTypeCategory category;

    String displayName;

    List<String> extensions;

    public static CategoryInfo of(FileTypeCategory category) {
        return new CategoryInfo(category, category.getDisplayName(),
                category.getExtensions().stream().sorted().toList());
    }
}
