package org.courier;

public class BaseConfig {

    public static final String PROJECT_NAME = BaseConfig.class.getPackage().getImplementationTitle();
    public static final String PROJECT_VERSION = BaseConfig.class.getPackage().getImplementationVersion();

    static final String DATA_DIRECTORY_NAME = "courier";
    static final String PASSPHRASE_ENVIRONMENT_VARIABLE = "COURIER_PASSPHRASE";

    private BaseConfig() {
    }
}
