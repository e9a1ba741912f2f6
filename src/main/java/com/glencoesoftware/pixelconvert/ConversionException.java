/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

/**
 * Thrown when input cannot be converted.  No partial result is produced.
 */
public class ConversionException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final ConversionError error;

  /**
   * @param error failure kind
   * @param message detail message
   */
  public ConversionException(ConversionError error, String message) {
    super(message);
    this.error = error;
  }

  /**
   * @return failure kind
   */
  public ConversionError getError() {
    return error;
  }

}
