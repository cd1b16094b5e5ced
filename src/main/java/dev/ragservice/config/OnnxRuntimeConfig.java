package dev.ragservice.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Initialises the ONNX Runtime environment before the embedding model bean is created.
 *
 * <p>The {@code AllMiniLmL6V2QuantizedEmbeddingModel} obtains the process-wide {@link
 * OrtEnvironment} when it is instantiated, and that singleton cannot be reconfigured afterwards.
 * Running as a {@link BeanFactoryPostProcessor} guarantees the thread pools are set first. Because
 * post-processors run before property binding, the thread counts are read straight from the {@link
 * Environment}:
 *
 * <ul>
 *   <li>{@code ragservice.onnx.intra-op-threads} (default 4)
 *   <li>{@code ragservice.onnx.inter-op-threads} (default 2)
 * </ul>
 *
 * <p>Thread spinning is disabled so idle ONNX workers do not compete with the fan-out pool.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    this.intraOpThreads =
        environment.getProperty("ragservice.onnx.intra-op-threads", Integer.class, 4);
    this.interOpThreads =
        environment.getProperty("ragservice.onnx.inter-op-threads", Integer.class, 2);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "rag-service", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
