package com.mobifone.updatecenter.common;

public class Constants {
    public interface STORE {
        interface ENDPOINT {
            // relative to store-api.url
            String BATCH_INSTALL     = "/installer/batch/install";
            String PROGRESS          = "/installer/progress/{handleId}";

            String PACKAGE           = "/inventory/packages/{packageId}";
            String AVAILABLE_UPDATES = "/inventory/updates";
        }

        String NAME_SERVICE = "STORE";
    }

    public interface BATCH {
        int INSTALL_ORDER_STEP = 100;
        int RECENT_ACTIVITY_LIMIT = 50;
        int DEFAULT_FEED_LIMIT = 100;
        int MAX_FEED_LIMIT = 500;
        String MANIFEST_NAME = "Update Center Batch Install";
        String MANIFEST_NOTES = "Batch installation via Update Center";
    }
}
