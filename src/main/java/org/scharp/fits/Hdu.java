///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A Header Data Unit: a header and the data segment it describes.
 * <p>
 * Instances of this class are immutable.  They are created by {@link HeaderBuilder} for writing and by
 * {@link FitsReader} for reading.
 * </p>
 */
public final class Hdu {

    private final HduType type;
    private final Header header;
    private final HduData data;

    Hdu(HduType type, Header header, HduData data) {
        assert type != null : "type must not be null";
        assert header != null : "header must not be null";
        assert data != null : "data must not be null";

        this.type = type;
        this.header = header;
        this.data = data;
    }

    /**
     * Gets the kind of this HDU.
     *
     * @return The kind of HDU.
     */
    public HduType type() {
        return type;
    }

    /**
     * Gets this HDU's header.
     *
     * @return The header.
     */
    public Header header() {
        return header;
    }

    /**
     * Creates a copy of this HDU with a different header, such as one made by {@link Header#addKey},
     * {@link Header#editKey}, {@link Header#deleteKey}, or {@link Header#renameKey}.
     * <pre>
     * Hdu edited = hdu.withHeader(hdu.header().addKey(HeaderRecord.string("OBSERVER", "Hubble", "")));
     * </pre>
     *
     * @param newHeader
     *     The new header.  Its mandatory records must be the same as those of this HDU's header, so that it still
     *     describes this HDU's data.
     *
     * @return The new HDU.
     *
     * @throws NullPointerException
     *     if {@code newHeader} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code newHeader}'s mandatory records differ from those of this HDU's header.
     */
    public Hdu withHeader(Header newHeader) {
        ArgumentUtil.checkNotNull(newHeader, "newHeader");
        if (!header.mandatoryRecords().equals(newHeader.mandatoryRecords())) {
            throw new IllegalArgumentException("the new header's mandatory records differ from those of the HDU");
        }
        return new Hdu(type, newHeader, data);
    }

    /**
     * Gets this HDU's data. For a primary or image HDU, this is an {@link ImageData}.  For a table HDU, this is an
     * {@link AsciiTableData}.
     *
     * @return The data.
     */
    public HduData data() {
        return data;
    }
}
