///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The kinds of HDU that this library supports.
 */
public enum HduType {

    /** The first HDU of a file, which starts with {@code SIMPLE}. */
    PRIMARY(null),

    /** An image extension, {@code XTENSION = 'IMAGE'}. */
    IMAGE("IMAGE"),

    /** An ASCII table extension, {@code XTENSION = 'TABLE'}. */
    TABLE("TABLE");

    private final String extensionName;

    HduType(String extensionName) {
        this.extensionName = extensionName;
    }

    /**
     * Gets the value of the {@code XTENSION} keyword for this kind of HDU.
     *
     * @return The extension name, or {@code null} for {@link #PRIMARY}.
     */
    public String extensionName() {
        return extensionName;
    }

    /**
     * Determines the kind of HDU that a header describes.
     *
     * @param header
     *     The header.
     *
     * @return The kind of HDU.
     *
     * @throws FitsFormatException
     *     if the header starts with neither {@code SIMPLE} nor {@code XTENSION}, or if it describes an extension
     *     which isn't supported.
     */
    static HduType forHeader(Header header) throws FitsFormatException {
        if (header.size() == 0) {
            throw new FitsFormatException("header is empty");
        }
        String firstKeyword = header.keyword(0);
        if (firstKeyword.equals("SIMPLE")) {
            return PRIMARY;
        }
        if (!firstKeyword.equals("XTENSION")) {
            throw new FitsFormatException("header starts with " + firstKeyword + " instead of SIMPLE or XTENSION");
        }

        String extensionName = header.stringValue("XTENSION");
        for (HduType type : values()) {
            if (extensionName.equals(type.extensionName)) {
                return type;
            }
        }
        throw new FitsFormatException("'" + extensionName + "' is not a supported extension");
    }
}
