package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FilesListResponse(boolean ok, String error, List<SlackFile> files, SlackPaging paging)
    implements SlackResponse {

  public FilesListResponse {
    files = files == null ? List.of() : List.copyOf(files);
  }
}
