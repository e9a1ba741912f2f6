/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */

package com.glencoesoftware.pixelconvert;

import picocli.CommandLine.ITypeConverter;

/**
 * Convert a string to a WideFormat.
 */
public class WideFormatConverter implements ITypeConverter<WideFormat> {
  @Override
  public WideFormat convert(String value) throws Exception {
    if (value == null) {
      return WideFormat.NONE;
    }
    return WideFormat.fromString(value);
  }
}
