package com.ledgerbook.journal.model;

public record Folder(long id, String name, FolderType folderType) {

    public Folder {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("folder name must be provided");
        }
        if (folderType == null) {
            folderType = FolderType.PAYABLE;
        }
    }
}
