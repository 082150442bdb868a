package org.chucc.deckedit.config;

import org.chucc.deckedit.command.CommandRegistry;
import org.chucc.deckedit.command.CreateSlideCommand;
import org.chucc.deckedit.command.DeleteSlideCommand;
import org.chucc.deckedit.command.MoveSlideCommand;
import org.chucc.deckedit.command.UpdateSlideCommand;
import org.chucc.deckedit.repository.SlideStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the command registry and registers every command type at startup,
 * before any request is handled.
 */
@Configuration
public class CommandRegistryConfig {

  /**
   * Creates the registry with reconstructors for all slide commands.
   * Reconstructed commands are bound to the application's slide store.
   *
   * @param slideStore the slide store
   * @return the populated registry
   */
  @Bean
  public CommandRegistry commandRegistry(SlideStore slideStore) {
    CommandRegistry registry = new CommandRegistry();
    registry.register(CreateSlideCommand.TYPE, r -> new CreateSlideCommand(r, slideStore));
    registry.register(UpdateSlideCommand.TYPE, r -> new UpdateSlideCommand(r, slideStore));
    registry.register(DeleteSlideCommand.TYPE, r -> new DeleteSlideCommand(r, slideStore));
    registry.register(MoveSlideCommand.TYPE, r -> new MoveSlideCommand(r, slideStore));
    return registry;
  }
}
