package de.mirkosertic.mcp.vehiclesearch.seed;

import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.error.ConstraintViolationException;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleIndexService;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Loads the synthetic inventory at startup when the index is empty or was written with an
 * older schema.
 */
public class InventorySeeder {

    private static final Logger logger = LoggerFactory.getLogger(InventorySeeder.class);

    private final ApplicationConfig config;
    private final VehicleIndexService indexService;
    private final SyntheticInventoryGenerator generator;

    public InventorySeeder(final ApplicationConfig config, final VehicleIndexService indexService,
                           final SyntheticInventoryGenerator generator) {
        this.config = config;
        this.indexService = indexService;
        this.generator = generator;
    }

    /**
     * @return the number of vehicles written, 0 if seeding was skipped
     */
    public int seedIfNeeded() throws IOException, ConstraintViolationException {
        if (!config.isSeedEnabled()) {
            logger.info("Inventory seeding disabled");
            return 0;
        }

        if (indexService.isSchemaUpgradeRequired()) {
            logger.warn("Schema version changed, reloading inventory");
            indexService.deleteAll();
        } else if (indexService.getDocumentCount() > 0) {
            logger.info("Inventory already contains {} vehicles, skipping seeding", indexService.getDocumentCount());
            return 0;
        }

        final List<Vehicle> vehicles = generator.generate(config.getSeedCount());
        indexService.indexAll(vehicles);
        indexService.refreshSearcher();
        logger.info("Seeded inventory with {} vehicles", vehicles.size());
        return vehicles.size();
    }
}
