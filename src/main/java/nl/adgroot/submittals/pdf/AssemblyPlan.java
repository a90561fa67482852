package nl.adgroot.submittals.pdf;

import java.nio.file.Path;
import java.util.Map;

import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.tags.RawFile;

/**
 * Everything the assembler reads: the structure, the rendered PDF of each input file and the
 * title page of each group tag. Built once per run and never changed.
 */
public record AssemblyPlan(Structure structure, Map<RawFile, Path> renderedPdfs, Map<String, Path> titlePages) {

  public AssemblyPlan {
    renderedPdfs = Map.copyOf(renderedPdfs);
    titlePages = Map.copyOf(titlePages);
  }
}
