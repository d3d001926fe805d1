package com.github.pfc.execution.actions;

import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.PfcAction;
import com.github.pfc.PfcException;
import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.execution.StepStateMachine;
import com.github.pfc.executive.EventController;
import com.github.pfc.executive.Exchange;

/**
 * Precondition that lets a group of steps start only in the order of their indices. All members of
 * a group share a sequence key; the member with index 0 starts at once, and each later member
 * waits until its predecessor in the group has been given permission.
 *
 * Notes for users:<br>
 * 1. the group meets in the execution context {@code rootHeight} levels above the step instance's
 * context. The default of 1 is the context of the chart run that holds the steps<br>
 *
 * 2. install with {@code step.setPrecondition(sequencer.getPrecondition())}<br>
 */
public final class Sequencer {
  private static final Logger logger = LogManager.getLogger(Sequencer.class.getSimpleName());

  private final UUID sequenceKey;
  private final int index;
  private final int rootHeight;

  public Sequencer(final UUID sequenceKey, final int index) {
    this(sequenceKey, index, 1);
  }

  public Sequencer(final UUID sequenceKey, final int index, final int rootHeight) {
    this.sequenceKey = sequenceKey;
    this.index = index;
    this.rootHeight = rootHeight;
  }

  public PfcAction getPrecondition() {
    return this::getPermissionToStart;
  }

  public int getIndex() {
    return index;
  }

  private void getPermissionToStart(final PfcExecutionContext context,
      final StepStateMachine stepStateMachine) throws PfcException {
    final PfcExecutionContext root = ascend(context);
    final Exchange exchange;
    if (index == 0) {
      exchange = new Exchange(context.getExecutive());
      root.put(sequenceKey, exchange);
    } else {
      exchange = awaitExchange(context, root);
      logDebug(context.getName(), "waiting for its turn at index " + index);
      exchange.take(keyFor(index), true);
    }
    logDebug(context.getName(), "granted at index " + index);
    exchange.post(keyFor(index + 1), Integer.valueOf(index + 1));
  }

  private PfcExecutionContext ascend(final PfcExecutionContext context) {
    PfcExecutionContext root = context;
    for (int ascents = rootHeight; ascents > 0 && root.getParent() != null; ascents--) {
      root = root.getParent();
    }
    return root;
  }

  private Exchange awaitExchange(final PfcExecutionContext context,
      final PfcExecutionContext root) throws PfcException {
    Exchange exchange = (Exchange) root.get(sequenceKey);
    if (exchange != null) {
      return exchange;
    }
    final EventController controller = context.getExecutive().getCurrentEventController();
    final PfcExecutionContext.EntryListener listener = (ctx, key, value) -> {
      if (sequenceKey.equals(key)) {
        controller.resume();
      }
    };
    root.addEntryListener(listener);
    try {
      while ((exchange = (Exchange) root.get(sequenceKey)) == null) {
        controller.suspend();
      }
    } finally {
      root.removeEntryListener(listener);
    }
    return exchange;
  }

  private UUID keyFor(final int memberIndex) {
    return new UUID(sequenceKey.getMostSignificantBits(),
        sequenceKey.getLeastSignificantBits() + memberIndex);
  }

  @Override
  public String toString() {
    return "Sequencer [sequenceKey=" + sequenceKey + ", index=" + index + ", rootHeight="
        + rootHeight + "]";
  }

  private static void logDebug(final String contextName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[c:").append(contextName).append("] ")
          .append(message));
    }
  }

}
