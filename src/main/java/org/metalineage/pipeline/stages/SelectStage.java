package org.metalineage.pipeline.stages;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.output.CandidateListWriter;
import org.metalineage.pipeline.selection.CandidateSelector;
import org.metalineage.pipeline.selection.CandidateSelector.DatabaseScreen;
import org.metalineage.pipeline.selection.CandidateSelector.SelectionResult;
import org.metalineage.pipeline.selection.ScreenTableReader;
import org.metalineage.pipeline.selection.SelectionSettings;

/**
 * Runs the adaptive threshold selection over the stored screen tables and writes the
 * unioned candidate list.
 */
public class SelectStage implements IPipelineStage {

    @Override
    public String getName() {
        return "select";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return Files.isRegularFile(context.selectedCandidates());
    }

    @Override
    public void execute(PipelineContext context) {
        List<DatabaseScreen> screens = new ArrayList<>();
        for (ReferenceDatabase db : context.getDatabases()) {
            try {
                screens.add(new DatabaseScreen(db.name(), db.initialThreshold(),
                        ScreenTableReader.read(context.screenTable(db)).hits()));
            } catch (IOException e) {
                throw new InputException("Cannot read screen table " + context.screenTable(db)
                        + ": " + e.getMessage(), e);
            }
        }
        SelectionSettings settings = SelectionSettings.fromConfig(context.getSettings().getConfig("selection"));
        SelectionResult result = new CandidateSelector(settings, context::addWarning)
                .select(screens, context.getQueryFiles().size());
        try {
            CandidateListWriter.write(context.selectedCandidates(), result.candidateIds());
        } catch (IOException e) {
            throw new PipelineException("Cannot write candidate list: " + e.getMessage(), e);
        }
    }
}
