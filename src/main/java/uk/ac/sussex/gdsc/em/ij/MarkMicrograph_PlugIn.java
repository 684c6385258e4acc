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
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.ij.ImageJPluginLoggerHelper;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.em.selection.MarkedMicrographs;

/**
 * Toggles the bad mark on the micrograph in the current image and saves the marked list.
 */
public class MarkMicrograph_PlugIn implements PlugIn {
  private static final String TITLE = "Mark Micrograph";
  private static final String SETTING_MARKED = "gdsc.em.selection.marked";

  /** The default marked list file. */
  static final String DEFAULT_MARKED_FILE = "marked_micrographs.txt";

  /** {@inheritDoc} */
  @Override
  public void run(String arg) {
    final ImagePlus imp = WindowManager.getCurrentImage();
    if (imp == null) {
      IJ.noImage();
      return;
    }

    String file = Prefs.get(SETTING_MARKED, DEFAULT_MARKED_FILE);
    if ("options".equals(arg)) {
      final GenericDialog gd = new GenericDialog(TITLE);
      gd.addStringField("Marked_list", file, 30);
      gd.showDialog();
      if (gd.wasCanceled()) {
        return;
      }
      file = gd.getNextString().trim();
      Prefs.set(SETTING_MARKED, file);
    }

    final Logger logger = ImageJPluginLoggerHelper.getLogger(this.getClass());
    final Path path = Paths.get(file).toAbsolutePath();
    final String micrograph = imp.getTitle();
    try {
      final MarkedMicrographs marked = MarkedMicrographs.load(path);
      final boolean isMarked = marked.toggle(micrograph);
      marked.save(path);
      logger.info(() -> String.format("%s %s (%s)", micrograph,
          isMarked ? "marked" : "unmarked", TextUtils.pleural(marked.size(), "marked micrograph")));
    } catch (final IOException ex) {
      logger.log(Level.WARNING, ex, () -> "Failed to update " + path);
      IJ.error(TITLE, ex.getMessage());
    }
  }
}
