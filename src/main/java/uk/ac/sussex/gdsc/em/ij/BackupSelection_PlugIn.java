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
import ij.Prefs;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.ij.ImageJPluginLoggerHelper;
import uk.ac.sussex.gdsc.em.selection.BackupSelectionWriter;
import uk.ac.sussex.gdsc.em.selection.MarkedMicrographs;

/**
 * Writes a backup selection STAR file that deselects the micrographs marked as bad.
 */
public class BackupSelection_PlugIn implements PlugIn {
  private static final String TITLE = "Backup Selection";

  /**
   * Contains the settings that are the re-usable state of the plugin.
   */
  private static class Settings {
    private static final String SETTING_MICROGRAPHS = "gdsc.em.selection.micrographs";
    private static final String SETTING_MARKED = "gdsc.em.selection.marked";
    private static final String SETTING_OUTPUT = "gdsc.em.selection.output";

    /** The last settings used by the plugin. This should be updated after plugin execution. */
    private static final AtomicReference<Settings> lastSettings =
        new AtomicReference<>(new Settings());

    String micrographs;
    String marked;
    String output;

    Settings() {
      micrographs = Prefs.get(SETTING_MICROGRAPHS, "micrographs.star");
      marked = Prefs.get(SETTING_MARKED, MarkMicrograph_PlugIn.DEFAULT_MARKED_FILE);
      output = Prefs.get(SETTING_OUTPUT, BackupSelectionWriter.DEFAULT_NAME);
    }

    Settings(Settings source) {
      micrographs = source.micrographs;
      marked = source.marked;
      output = source.output;
    }

    Settings copy() {
      return new Settings(this);
    }

    static Settings load() {
      return lastSettings.get().copy();
    }

    void save() {
      lastSettings.set(this);
      Prefs.set(SETTING_MICROGRAPHS, micrographs);
      Prefs.set(SETTING_MARKED, marked);
      Prefs.set(SETTING_OUTPUT, output);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void run(String arg) {
    final Settings settings = Settings.load();
    final GenericDialog gd = new GenericDialog(TITLE);
    gd.addMessage("Deselect the marked micrographs in a copy of the selection");
    gd.addStringField("Micrographs_STAR", settings.micrographs, 30);
    gd.addStringField("Marked_list", settings.marked, 30);
    gd.addStringField("Output", settings.output, 30);
    gd.showDialog();
    if (gd.wasCanceled()) {
      return;
    }
    settings.micrographs = gd.getNextString().trim();
    settings.marked = gd.getNextString().trim();
    settings.output = gd.getNextString().trim();
    settings.save();

    final Logger logger = ImageJPluginLoggerHelper.getLogger(this.getClass());
    try {
      final MarkedMicrographs marked = MarkedMicrographs.load(Paths.get(settings.marked));
      final Path output = Paths.get(settings.output).toAbsolutePath();
      final int count =
          BackupSelectionWriter.write(Paths.get(settings.micrographs), marked, output);
      IJ.showStatus(TITLE + ": deselected " + count);
    } catch (final IOException ex) {
      logger.log(Level.WARNING, ex, () -> "Failed to write " + settings.output);
      IJ.error(TITLE, ex.getMessage());
    }
  }
}
