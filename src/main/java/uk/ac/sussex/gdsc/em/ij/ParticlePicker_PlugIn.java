/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package uk.ac.sussex.gdsc.em.ij;

import ij.IJ;
import ij.ImagePlus;
import ij.Prefs;
import ij.gui.GenericDialog;
import ij.gui.PointRoi;
import ij.plugin.filter.PlugInFilter;
import ij.process.ImageProcessor;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.ij.ImageJPluginLoggerHelper;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.em.coords.CoordinateLinkTable;
import uk.ac.sussex.gdsc.em.coords.CoordinateMapper;
import uk.ac.sussex.gdsc.em.picker.AutoPickResult;
import uk.ac.sussex.gdsc.em.picker.AutoPicker;
import uk.ac.sussex.gdsc.em.picker.CandidatePoint;
import uk.ac.sussex.gdsc.em.picker.ContrastMethod;
import uk.ac.sussex.gdsc.em.picker.PickerParameters;
import uk.ac.sussex.gdsc.em.picker.RefinementMethod;
import uk.ac.sussex.gdsc.em.star.CoordinateFiles;
import uk.ac.sussex.gdsc.em.star.StarFile;

/**
 * Picks particles in a micrograph preview and shows them as a point ROI.
 *
 * <p>The particle diameter and minimum distance are entered in the units of the full-resolution
 * pixel size (Angstrom) and converted to display pixels using the scale between the full-resolution
 * micrograph and the preview.
 *
 * <p>Existing coordinates can be loaded from a STAR file in the coordinate directory instead of
 * picking. The points can be saved to the curated STAR file mapped to the full-resolution size.
 */
public class ParticlePicker_PlugIn implements PlugInFilter {
  private static final String TITLE = "Particle Picker";
  private static final int FLAGS = DOES_8G | DOES_16 | DOES_32 | NO_CHANGES;
  /** The default full-resolution pixel size (Angstrom per pixel). */
  private static final double DEFAULT_PIXEL_SIZE = 1.94;
  /** The default particle diameter (Angstrom). */
  private static final double DEFAULT_DIAMETER = 100;

  private ImagePlus imp;
  private Logger logger;

  /** The current settings for the plugin instance. */
  private Settings settings;

  /**
   * Contains the settings that are the re-usable state of the plugin.
   */
  private static class Settings {
    private static final String SETTING_PIXEL_SIZE = "gdsc.em.picker.pixelSize";
    private static final String SETTING_DIAMETER = "gdsc.em.picker.diameterAngstrom";
    private static final String SETTING_MIN_DISTANCE = "gdsc.em.picker.minDistanceAngstrom";
    private static final String SETTING_THRESHOLD = "gdsc.em.picker.threshold";
    private static final String SETTING_BLUR = "gdsc.em.picker.blur";
    private static final String SETTING_NEGATIVE_STAIN = "gdsc.em.picker.negativeStain";
    private static final String SETTING_REFINEMENT = "gdsc.em.picker.refinement";
    private static final String SETTING_REFINEMENT_THRESHOLD =
        "gdsc.em.picker.refinementThreshold";
    private static final String SETTING_CONTRAST = "gdsc.em.picker.contrast";
    private static final String SETTING_LOAD_EXISTING = "gdsc.em.picker.loadExisting";
    private static final String SETTING_DIRECTORY = "gdsc.em.picker.directory";
    private static final String SETTING_FULL_WIDTH = "gdsc.em.picker.fullWidth";
    private static final String SETTING_FULL_HEIGHT = "gdsc.em.picker.fullHeight";
    private static final String SETTING_INVERT_Y = "gdsc.em.picker.invertY";
    private static final String SETTING_SAVE = "gdsc.em.picker.save";

    /** The last settings used by the plugin. This should be updated after plugin execution. */
    private static final AtomicReference<Settings> lastSettings =
        new AtomicReference<>(new Settings());

    final PickerParameters parameters;
    double pixelSize;
    double diameter;
    double minDistance;
    boolean loadExisting;
    String directory;
    int fullWidth;
    int fullHeight;
    boolean invertY;
    boolean save;

    /**
     * Default constructor.
     */
    Settings() {
      parameters = new PickerParameters();
      pixelSize = Prefs.get(SETTING_PIXEL_SIZE, DEFAULT_PIXEL_SIZE);
      diameter = Prefs.get(SETTING_DIAMETER, DEFAULT_DIAMETER);
      minDistance = Prefs.get(SETTING_MIN_DISTANCE, 0);
      parameters.setThreshold(Prefs.get(SETTING_THRESHOLD, PickerParameters.DEFAULT_THRESHOLD));
      parameters.setBlurSigma(Prefs.get(SETTING_BLUR, PickerParameters.DEFAULT_BLUR_SIGMA));
      parameters.setNegativeStain(Prefs.get(SETTING_NEGATIVE_STAIN, false));
      parameters.setRefinementMethod(RefinementMethod.fromOrdinal(
          (int) Prefs.get(SETTING_REFINEMENT, RefinementMethod.THRESHOLDING.ordinal()),
          RefinementMethod.NONE));
      parameters.setRefinementThreshold(
          Prefs.get(SETTING_REFINEMENT_THRESHOLD, PickerParameters.DEFAULT_REFINEMENT_THRESHOLD));
      parameters.setContrastMethod(ContrastMethod.fromOrdinal(
          (int) Prefs.get(SETTING_CONTRAST, ContrastMethod.NONE.ordinal()), ContrastMethod.NONE));
      loadExisting = Prefs.get(SETTING_LOAD_EXISTING, false);
      directory = Prefs.get(SETTING_DIRECTORY, "");
      fullWidth = (int) Prefs.get(SETTING_FULL_WIDTH, 0);
      fullHeight = (int) Prefs.get(SETTING_FULL_HEIGHT, 0);
      invertY = Prefs.get(SETTING_INVERT_Y, false);
      save = Prefs.get(SETTING_SAVE, false);
    }

    /**
     * Copy constructor.
     *
     * @param source the source
     */
    private Settings(Settings source) {
      parameters = source.parameters.copy();
      pixelSize = source.pixelSize;
      diameter = source.diameter;
      minDistance = source.minDistance;
      loadExisting = source.loadExisting;
      directory = source.directory;
      fullWidth = source.fullWidth;
      fullHeight = source.fullHeight;
      invertY = source.invertY;
      save = source.save;
    }

    /**
     * Copy the settings.
     *
     * @return the settings
     */
    Settings copy() {
      return new Settings(this);
    }

    /**
     * Load a copy of the settings.
     *
     * @return the settings
     */
    static Settings load() {
      return lastSettings.get().copy();
    }

    /**
     * Save the settings.
     */
    void save() {
      lastSettings.set(this);
      Prefs.set(SETTING_PIXEL_SIZE, pixelSize);
      Prefs.set(SETTING_DIAMETER, diameter);
      Prefs.set(SETTING_MIN_DISTANCE, minDistance);
      Prefs.set(SETTING_THRESHOLD, parameters.getThreshold());
      Prefs.set(SETTING_BLUR, parameters.getBlurSigma());
      Prefs.set(SETTING_NEGATIVE_STAIN, parameters.isNegativeStain());
      Prefs.set(SETTING_REFINEMENT, parameters.getRefinementMethod().ordinal());
      Prefs.set(SETTING_REFINEMENT_THRESHOLD, parameters.getRefinementThreshold());
      Prefs.set(SETTING_CONTRAST, parameters.getContrastMethod().ordinal());
      Prefs.set(SETTING_LOAD_EXISTING, loadExisting);
      Prefs.set(SETTING_DIRECTORY, directory);
      Prefs.set(SETTING_FULL_WIDTH, fullWidth);
      Prefs.set(SETTING_FULL_HEIGHT, fullHeight);
      Prefs.set(SETTING_INVERT_Y, invertY);
      Prefs.set(SETTING_SAVE, save);
    }
  }

  /** {@inheritDoc} */
  @Override
  public int setup(String arg, ImagePlus imp) {
    if (imp == null) {
      IJ.noImage();
      return DONE;
    }
    this.imp = imp;
    logger = ImageJPluginLoggerHelper.getLogger(this.getClass());
    return showDialog() ? FLAGS : DONE;
  }

  private boolean showDialog() {
    settings = Settings.load();
    final PickerParameters parameters = settings.parameters;

    final GenericDialog gd = new GenericDialog(TITLE);
    gd.addMessage("Find particles as local maxima of the background-subtracted image.\n"
        + "Distances are in Angstrom at the full-resolution pixel size.");
    gd.addNumericField("Pixel_size", settings.pixelSize, 3, 6, "A/px");
    gd.addNumericField("Particle_diameter", settings.diameter, 1, 6, "A");
    gd.addNumericField("Min_distance", settings.minDistance, 1, 6, "A (0 = auto)");
    gd.addSlider("Threshold", 0, 1, parameters.getThreshold());
    gd.addNumericField("Blur", parameters.getBlurSigma(), 2);
    gd.addCheckbox("Negative_stain", parameters.isNegativeStain());
    gd.addChoice("Contrast", ContrastMethod.getDescriptions(),
        parameters.getContrastMethod().getDescription());
    gd.addChoice("Refinement", RefinementMethod.getDescriptions(),
        parameters.getRefinementMethod().getDescription());
    gd.addNumericField("Refinement_threshold", parameters.getRefinementThreshold(), 2);
    gd.addMessage("Coordinates (full-resolution size of 0 uses the image size)");
    gd.addCheckbox("Load_existing", settings.loadExisting);
    gd.addStringField("Coordinate_directory", settings.directory, 30);
    gd.addNumericField("Full_width", settings.fullWidth, 0);
    gd.addNumericField("Full_height", settings.fullHeight, 0);
    gd.addCheckbox("Invert_Y", settings.invertY);
    gd.addCheckbox("Save_coordinates", settings.save);

    gd.showDialog();
    if (gd.wasCanceled()) {
      return false;
    }

    settings.pixelSize = gd.getNextNumber();
    settings.diameter = gd.getNextNumber();
    settings.minDistance = gd.getNextNumber();
    parameters.setThreshold(gd.getNextNumber());
    parameters.setBlurSigma(gd.getNextNumber());
    parameters.setNegativeStain(gd.getNextBoolean());
    parameters.setContrastMethod(ContrastMethod.fromDescription(gd.getNextChoice()));
    parameters.setRefinementMethod(RefinementMethod.fromDescription(gd.getNextChoice()));
    parameters.setRefinementThreshold(gd.getNextNumber());
    settings.loadExisting = gd.getNextBoolean();
    settings.directory = gd.getNextString().trim();
    settings.fullWidth = (int) gd.getNextNumber();
    settings.fullHeight = (int) gd.getNextNumber();
    settings.invertY = gd.getNextBoolean();
    settings.save = gd.getNextBoolean();
    settings.save();

    if (!(settings.pixelSize > 0 && settings.diameter > 0)) {
      IJ.error(TITLE, "The pixel size and particle diameter must be positive");
      return false;
    }
    if ((settings.loadExisting || settings.save) && settings.directory.isEmpty()) {
      IJ.error(TITLE, "A coordinate directory is required to load or save coordinates");
      return false;
    }
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public void run(ImageProcessor ip) {
    final CoordinateMapper mapper = createMapper(ip);
    final CoordinateLinkTable table = new CoordinateLinkTable();
    final String micrograph = imp.getTitle();

    try {
      if (!settings.loadExisting || !loadExisting(micrograph, mapper, table)) {
        final PickerParameters parameters = createParameters(mapper);
        if (parameters == null) {
          return;
        }
        final AutoPickResult result = new AutoPicker().run(ip, parameters);
        if (!result.isOk()) {
          IJ.error(TITLE, result.getMessage());
          return;
        }
        table.replaceWithPicked(result.getPoints());
      }

      showPoints(table.getDisplayPoints());
      logger.info(() -> micrograph + ": " + TextUtils.pleural(table.size(), "particle"));

      if (settings.save) {
        final Path path = CoordinateFiles.getCuratedPath(Paths.get(settings.directory), micrograph);
        StarFile.writeCoordinates(path, table.toFullResolution(mapper));
        logger.info(() -> "Saved coordinates to " + path);
      }
    } catch (final IOException ex) {
      logger.log(Level.WARNING, ex, () -> "Failed to process coordinates for " + micrograph);
      IJ.error(TITLE, ex.getMessage());
    }
  }

  /**
   * Create the picker parameters with the distances converted to display pixels.
   *
   * @param mapper the mapper
   * @return the parameters (or null if the particle is smaller than a display pixel)
   */
  private PickerParameters createParameters(CoordinateMapper mapper) {
    final PickerParameters parameters = settings.parameters.copy();
    final int diameter = mapper.toDisplayLength(settings.diameter, settings.pixelSize);
    if (diameter < 1) {
      IJ.error(TITLE, String.format("Particle diameter %s A is less than a display pixel (%s A)",
          MathUtils.rounded(settings.diameter),
          MathUtils.rounded(mapper.getDisplayPixelSize(settings.pixelSize))));
      return null;
    }
    parameters.setParticleDiameter(diameter);
    // Zero is auto
    parameters.setMinDistance(settings.minDistance > 0
        ? Math.max(1, mapper.toDisplayLength(settings.minDistance, settings.pixelSize))
        : 0);
    logger.fine(() -> String.format("Display pixel size %s A: %s",
        MathUtils.rounded(mapper.getDisplayPixelSize(settings.pixelSize)), parameters));
    return parameters;
  }

  private CoordinateMapper createMapper(ImageProcessor ip) {
    final int width = ip.getWidth();
    final int height = ip.getHeight();
    return new CoordinateMapper(settings.fullWidth > 0 ? settings.fullWidth : width,
        settings.fullHeight > 0 ? settings.fullHeight : height, width, height, settings.invertY);
  }

  private boolean loadExisting(String micrograph, CoordinateMapper mapper,
      CoordinateLinkTable table) throws IOException {
    final Path path = CoordinateFiles.findCoordinateFile(Paths.get(settings.directory), micrograph);
    if (path == null) {
      logger.info(() -> "No coordinate file for " + micrograph + "; picking particles");
      return false;
    }
    final List<CandidatePoint> points = StarFile.readCoordinates(path);
    final int count = table.load(points, mapper);
    logger.info(() -> "Loaded " + TextUtils.pleural(count, "coordinate") + " from " + path);
    return true;
  }

  private void showPoints(List<CandidatePoint> points) {
    if (points.isEmpty()) {
      imp.deleteRoi();
      return;
    }
    final float[] x = new float[points.size()];
    final float[] y = new float[x.length];
    for (int i = 0; i < x.length; i++) {
      final CandidatePoint p = points.get(i);
      x[i] = (float) p.getX();
      y[i] = (float) p.getY();
    }
    imp.setRoi(new PointRoi(x, y, x.length));
  }
}
