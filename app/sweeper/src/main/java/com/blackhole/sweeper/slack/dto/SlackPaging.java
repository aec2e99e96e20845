package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackPaging(int count, int total, int page, int pages) {

  public boolean hasNextPage() {
    return page < pages;
  }
}
