package com.example.fileinventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // A folder is required; the JSON config file is optional.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar file-inventory.jar <folder> [config.json]");
            System.exit(1);
        }
        Path folder = Path.of(args[0]);
        InventoryConfig config = args.length > 1
                ? new ConfigLoader().load(Path.of(args[1]))
                : ConfigLoader.defaults();
        InventoryService service = new InventoryService(config);
        ScanReport report = service.scan(folder);
        report.warnings().forEach(warning -> LOGGER.warn("{}", warning));
        if (!report.isSuccess() || report.saveFailed()) {
            LOGGER.error(report.statusMessage());
            System.exit(2);
        }
        LOGGER.info(report.statusMessage());
    }
}
