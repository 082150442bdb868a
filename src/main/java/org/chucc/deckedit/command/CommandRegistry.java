package org.chucc.deckedit.command;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.chucc.deckedit.exception.UnknownCommandTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps command type tags to reconstructors, for rehydrating serialized commands.
 *
 * <p>Populated once at startup (see
 * {@link org.chucc.deckedit.config.CommandRegistryConfig}) and read-only afterwards.
 * Instances are independent, so tests can build isolated registries.
 */
public class CommandRegistry {

  private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

  private final Map<String, CommandReconstructor> reconstructors = new ConcurrentHashMap<>();

  /**
   * Associates a type tag with a reconstructor. The last registration for a tag wins.
   *
   * @param commandType the type tag (must be non-null and non-blank)
   * @param reconstructor the reconstructor (must be non-null)
   */
  public void register(String commandType, CommandReconstructor reconstructor) {
    Objects.requireNonNull(commandType, "Command type cannot be null");
    Objects.requireNonNull(reconstructor, "Reconstructor cannot be null");
    if (commandType.isBlank()) {
      throw new IllegalArgumentException("Command type cannot be blank");
    }

    if (reconstructors.put(commandType, reconstructor) != null) {
      logger.info("Replaced reconstructor for command type {}", commandType);
    } else {
      logger.info("Registered reconstructor for command type {}", commandType);
    }
  }

  /**
   * Rebuilds a command from its record.
   *
   * @param commandRecord the record
   * @return the rebuilt command
   * @throws UnknownCommandTypeException if no reconstructor is registered for the record's type
   */
  public Command create(CommandRecord commandRecord) {
    Objects.requireNonNull(commandRecord, "Command record cannot be null");
    CommandReconstructor reconstructor = reconstructors.get(commandRecord.type());
    if (reconstructor == null) {
      throw new UnknownCommandTypeException(commandRecord.type());
    }
    return reconstructor.reconstruct(commandRecord);
  }

  /**
   * Checks whether a type tag is registered.
   *
   * @param commandType the type tag
   * @return true if registered
   */
  public boolean isRegistered(String commandType) {
    return commandType != null && reconstructors.containsKey(commandType);
  }

  /**
   * Gets all registered type tags.
   *
   * @return the type tags
   */
  public Set<String> registeredTypes() {
    return Set.copyOf(reconstructors.keySet());
  }
}
