package nl.adgroot.submittals.structure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import nl.adgroot.submittals.classify.DocumentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes a {@link Structure} as JSON so a person can reorder groups and documents or
 * retitle groups between extraction and assembly.
 *
 * <p>Groups are read back in {@code order}; documents in array order. A file that breaks the
 * structure invariants is rejected with a {@link StructureFormatException}.
 */
public class StructureSerializer {

  private static final Logger log = LoggerFactory.getLogger(StructureSerializer.class);

  private final ObjectMapper mapper = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public String toJson(Structure structure) {
    try {
      return mapper.writeValueAsString(structure);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Structure could not be serialized", e);
    }
  }

  public Structure fromJson(String json) {
    Structure raw;
    try {
      raw = mapper.readValue(json, Structure.class);
    } catch (JsonProcessingException e) {
      throw new StructureFormatException("Invalid structure JSON: " + e.getOriginalMessage(), e);
    }

    List<EquipmentGroup> groups = raw.groups().stream()
        .sorted(Comparator.comparingInt(EquipmentGroup::order))
        .toList();
    Structure structure = new Structure(raw.version(), groups);
    validate(structure);
    return structure;
  }

  public void write(Structure structure, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    Files.writeString(file, toJson(structure));
    log.info("Saved structure ({} groups) to {}", structure.groups().size(), file);
  }

  public Structure read(Path file) throws IOException {
    Structure structure = fromJson(Files.readString(file));
    log.info("Loaded structure ({} groups) from {}", structure.groups().size(), file);
    return structure;
  }

  static void validate(Structure structure) {
    if (structure.version() != Structure.CURRENT_VERSION) {
      throw new StructureFormatException("Unsupported structure version " + structure.version());
    }

    Set<String> tags = new HashSet<>();
    Set<String> paths = new HashSet<>();
    List<EquipmentGroup> groups = structure.groups();

    for (int i = 0; i < groups.size(); i++) {
      EquipmentGroup group = groups.get(i);
      if (!tags.add(group.tag())) {
        throw new StructureFormatException("Tag " + group.tag() + " appears in more than one group");
      }
      if (group.isCutSheets() && i != groups.size() - 1) {
        throw new StructureFormatException("The cut sheets section must be the last group");
      }

      for (DocumentEntry doc : group.documents()) {
        if (doc.file() == null || doc.file().path() == null || doc.role() == null) {
          throw new StructureFormatException("Incomplete document entry in group " + group.tag());
        }
        if (!paths.add(doc.file().path().toString())) {
          throw new StructureFormatException("File " + doc.filename() + " appears more than once");
        }
        if (group.isCutSheets() != (doc.role() == DocumentRole.CUTSHEET)) {
          throw new StructureFormatException(
              "Document " + doc.filename() + " with role " + doc.role() + " does not belong in group " + group.tag());
        }
      }
    }
  }
}
