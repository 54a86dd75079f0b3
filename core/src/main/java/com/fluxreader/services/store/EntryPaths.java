package com.fluxreader.services.store;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Directory layout of the local store: {@code <root>/<entryId>/entry.html} plus metadata and images.
 */
public class EntryPaths {
    public static final String HTML_FILE = "entry.html";
    public static final String METADATA_FILE = "metadata.json";

    private final File root;

    public EntryPaths(File root) {
        this.root = root;
    }

    public File getRoot() {
        return root;
    }

    public File entryDir(long entryId) {
        return new File(root, String.valueOf(entryId));
    }

    public File htmlFile(long entryId) {
        return new File(entryDir(entryId), HTML_FILE);
    }

    public File metadataFile(long entryId) {
        return new File(entryDir(entryId), METADATA_FILE);
    }

    public boolean isDownloaded(long entryId) {
        return htmlFile(entryId).isFile();
    }

    /**
     * Ids of every directory with a numeric name, downloaded or not, ascending.
     */
    public List<Long> listEntryIds() {
        List<Long> ids = new ArrayList<>();
        File[] children = root.listFiles(File::isDirectory);
        if (children == null) return ids;
        for (File child : children) {
            Long id = parseId(child.getName());
            if (id != null) ids.add(id);
        }
        Collections.sort(ids);
        return ids;
    }

    static Long parseId(String name) {
        if (name == null || name.isEmpty()) return null;
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) return null;
        }
        try {
            long id = Long.parseLong(name);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
