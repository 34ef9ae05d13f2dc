package org.pywalrus;

public class WalrusConfigurationException extends WalrusException {

    private final String setting;
    private final String value;

    public WalrusConfigurationException(String setting, String value) {
        super("Invalid value for " + setting + ": '" + value + "'");
        this.setting = setting;
        this.value = value;
    }

    public String getSetting() {
        return setting;
    }

    public String getValue() {
        return value;
    }
}
