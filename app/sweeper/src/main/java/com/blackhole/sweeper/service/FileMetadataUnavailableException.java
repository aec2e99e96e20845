/*
 * Where: Sweeper service layer
 * What: Signals that a file's owning channel could not be fetched from files.info
 * Why: Without the channel the file cannot be placed under any retention policy
 */
package com.blackhole.sweeper.service;

public class FileMetadataUnavailableException extends RuntimeException {

  private final String fileId;

  public FileMetadataUnavailableException(String fileId, Throwable cause) {
    super("file metadata unavailable for file " + fileId, cause);
    this.fileId = fileId;
  }

  public String fileId() {
    return fileId;
  }
}
