package dev.medrag.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Sets ONNX Runtime threading before the embedding and cross-encoder models load.
 *
 * <p>{@link OrtEnvironment} is a process-wide singleton that the bge-small-zh model creates on
 * first use and that cannot be reconfigured afterwards, so it is created here in a {@link
 * BeanFactoryPostProcessor}, ahead of any model bean. Spinning is disabled; intra-op threads follow
 * the available processors, capped at 4, leaving cores for the retrieval and tokenizer pools.
 */
@Configuration
@SuppressWarnings("NullAway")
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  static final int MAX_INTRA_OP_THREADS = 4;
  static final int INTER_OP_THREADS = 2;

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    int intraOp = Math.max(1, Math.min(MAX_INTRA_OP_THREADS, availableProcessors()));
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOp);
      threadingOptions.setGlobalInterOpNumThreads(INTER_OP_THREADS);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "medrag", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOp,
          INTER_OP_THREADS);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }

  static int availableProcessors() {
    return Runtime.getRuntime().availableProcessors();
  }
}
