package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/**
 * RFC 7807 Problem Details for slide editing errors.
 *
 * <p>The {@code type} is derived from the error code ({@code command_undo_conflict} becomes
 * {@code /problems/command-undo-conflict}). Failed commands also name their
 * {@code command_type}; {@code detail} carries the underlying store error when there is one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProblemDetail {

  private static final String TYPE_PREFIX = "/problems/";

  private String type;
  private String title;
  private int status;
  private String code;
  private String detail;
  @JsonProperty("command_type")
  private String commandType;

  /**
   * Default constructor for JSON deserialization.
   */
  public ProblemDetail() {
    // Required for JSON deserialization
  }

  /**
   * Creates a problem whose type URI is derived from the code.
   *
   * @param title human-readable summary
   * @param status HTTP status code
   * @param code canonical error code (snake_case)
   */
  public ProblemDetail(String title, int status, String code) {
    this.type = TYPE_PREFIX + code.replace('_', '-').toLowerCase(Locale.ROOT);
    this.title = title;
    this.status = status;
    this.code = code;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public int getStatus() {
    return status;
  }

  public void setStatus(int status) {
    this.status = status;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getDetail() {
    return detail;
  }

  public void setDetail(String detail) {
    this.detail = detail;
  }

  /**
   * Gets the type tag of the command that failed, if any.
   *
   * @return the command type, or null
   */
  public String getCommandType() {
    return commandType;
  }

  public void setCommandType(String commandType) {
    this.commandType = commandType;
  }
}
