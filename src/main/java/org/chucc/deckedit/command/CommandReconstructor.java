package org.chucc.deckedit.command;

/**
 * Rebuilds a command of one type from its serialized record.
 */
@FunctionalInterface
public interface CommandReconstructor {

  /**
   * Rebuilds a command.
   *
   * @param commandRecord the record, whose type matches the tag this reconstructor is
   *     registered under
   * @return the rebuilt command, in the lifecycle state the record describes
   * @throws IllegalArgumentException if the payload is malformed
   */
  Command reconstruct(CommandRecord commandRecord);
}
