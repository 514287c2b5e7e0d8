package com.example.fileinventory;

import java.nio.file.Path;

public class InventoryWarning {
    private final InventoryError error;
    private final String path;
    private final String message;

    public InventoryWarning(InventoryError error, Path path, String message) {
        this.error = error;
        this.path = path == null ? null : path.toString();
        this.message = message;
    }

    public InventoryError getError() {
        return error;
    }

    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return error + " " + path + ": " + message;
    }
}
