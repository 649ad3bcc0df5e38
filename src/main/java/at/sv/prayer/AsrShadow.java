package at.sv.prayer;

import java.util.Locale;

public enum AsrShadow {
    /**
     * Shafi, Maliki and Hanbali: shadow length equals the object height plus the noon shadow.
     */
    STANDARD(1),
    /**
     * Hanafi: shadow length equals twice the object height plus the noon shadow.
     */
    HANAFI(2);

    private final int factor;

    AsrShadow(int factor) {
        this.factor = factor;
    }

    public int getFactor() {
        return factor;
    }

    /**
     * Parses either the shadow factor ("1", "2") or the convention name ("standard", "shafi", "hanafi").
     *
     * @throws InvalidPropertyValue if the value is not supported
     */
    public static AsrShadow parse(String value) {
        if (value == null) {
            throw new InvalidPropertyValue("Missing asr shadow convention");
        }
        switch (value.trim().toLowerCase(Locale.ENGLISH)) {
            case "1":
            case "standard":
            case "shafi":
                return STANDARD;
            case "2":
            case "hanafi":
                return HANAFI;
            default:
                throw new InvalidPropertyValue("Invalid asr shadow convention '" + value + "'. Use 1 (standard) or" +
                                               " 2 (hanafi).");
        }
    }
}
