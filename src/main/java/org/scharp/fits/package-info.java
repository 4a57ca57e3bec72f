///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library writes, reads, and validates FITS files: the Flexible Image Transport System used by astronomers.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.fits.FitsWriter} for sample code on writing a FITS file.
 * </p>
 *
 * <h2>A FITS Primer for Java Programmers</h2>
 *
 * <p>
 * A FITS file is a sequence of 2880-byte blocks.  The blocks are grouped into Header Data Units (HDUs), each of which
 * is a header followed by an optional data segment.  The first HDU is the "primary" HDU.  Any HDU after it is an
 * "extension".  This library supports image extensions and ASCII table extensions.  The standard is maintained by
 * the IAU FITS Working Group and is available at <a
 * href="https://fits.gsfc.nasa.gov/fits_standard.html">https://fits.gsfc.nasa.gov/fits_standard.html</a>
 * </p>
 *
 * <p>
 * A header is a sequence of 80-character records, 36 to a block.  Most records assign a value to a keyword of at most
 * eight characters, like {@code NAXIS   =                    2 / number of data axes}.  The header ends with an
 * {@code END} record, and the rest of its last block is filled with blank records.  Headers must only contain the
 * printable ASCII characters, decimal 32 through 126.  The first keywords of a header are mandatory and must appear
 * in a fixed order, because they describe the size of the data segment that follows.  Other keywords can be added,
 * edited, deleted, or renamed with {@link org.scharp.fits.Header#addKey} and its sibling methods.
 * </p>
 *
 * <p>
 * The data of a primary or image HDU is an n-dimensional array of numbers, stored big-endian with the first axis
 * varying fastest.  The {@code BITPIX} keyword gives the size of each number in bits, negative for floating point.
 * FITS only has signed integers, except for bytes which are only unsigned, so other integer types are stored with
 * an offset that is given by the {@code BZERO} keyword.  For example, an unsigned 16-bit value is stored as a signed
 * 16-bit value with an offset of 32768.
 * </p>
 *
 * <p>
 * The data of an ASCII table is a sequence of fixed-width rows of text.  The header describes each column's name
 * ({@code TTYPEn}), starting position in the row ({@code TBCOLn}), and FORTRAN-style format ({@code TFORMn}).
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * This library enforces strict input checking to prevent unintentionally creating a malformed FITS file.  It throws
 * clear exceptions as soon as possible (fail-fast): {@code NullPointerException} or
 * {@code IllegalArgumentException} for data that cannot be written, and {@link org.scharp.fits.FitsFormatException}
 * for a stream that cannot be read.  The only exception is {@link org.scharp.fits.FormatValidator}, which reports
 * every problem it finds instead of throwing.
 * </p>
 */
package org.scharp.fits;
