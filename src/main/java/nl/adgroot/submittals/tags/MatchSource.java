package nl.adgroot.submittals.tags;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Where a tag was found. */
public enum MatchSource {
  @JsonProperty("filename") FILENAME,
  @JsonProperty("content") CONTENT
}
