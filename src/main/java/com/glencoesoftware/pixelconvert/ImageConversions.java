/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

/**
 * Builds pixel arrays from any supported kind of input.
 */
public class ImageConversions {

  private final DimensionResolver resolver;
  private final ArrayNormalizer normalizer;
  private final TableCodec tableCodec;

  /**
   * Create a converter that logs advisories.
   */
  public ImageConversions() {
    this(new LoggingAdvisoryListener());
  }

  /**
   * @param listener receives a notification whenever dimensions or axis
   *                 meanings are guessed
   */
  public ImageConversions(IAdvisoryListener listener) {
    resolver = new DimensionResolver(listener);
    normalizer = new ArrayNormalizer(listener);
    tableCodec = new TableCodec(listener);
  }

  /**
   * Convert input to a new pixel array.
   *
   * @param input data to convert
   * @return new pixel array
   * @throws ConversionException if the input cannot be converted
   */
  public PixelArray toPixelArray(ImageInput input) {
    return input.accept(new ImageInput.Visitor<PixelArray>() {
      @Override
      public PixelArray visitFlat(ImageInput.Flat flat) {
        double[] values = flat.getValues();
        Dimensions dims = resolver.resolve(values.length, flat.getAxisSizes());
        return PixelArray.wrap(dims, values);
      }

      @Override
      public PixelArray visitMatrix(ImageInput.Matrix matrix) {
        return normalize(matrix);
      }

      @Override
      public PixelArray visitVolume(ImageInput.Volume volume) {
        return normalize(volume);
      }

      @Override
      public PixelArray visitHypervolume(ImageInput.Hypervolume hyper) {
        return normalize(hyper);
      }

      @Override
      public PixelArray visitShaped(ImageInput.Shaped shaped) {
        return normalize(shaped);
      }

      @Override
      public PixelArray visitTabular(ImageInput.Tabular tabular) {
        if (tabular.getDimensions().isPresent()) {
          return tableCodec.decode(tabular.getTable(),
            tabular.getValueColumn(), tabular.getDimensions().get());
        }
        return tableCodec.decode(tabular.getTable(), tabular.getValueColumn());
      }
    });
  }

  private PixelArray normalize(ImageInput.Array array) {
    return normalizer.normalize(array.getShape(), array.getData());
  }

}
