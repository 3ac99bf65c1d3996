package dev.lexsearch.config;

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
 * Configures the ONNX Runtime environment with threading options before any ONNX model beans are
 * created.
 *
 * <p>Implements {@link BeanFactoryPostProcessor} so that the {@link OrtEnvironment} singleton is
 * initialised with custom threading options BEFORE Spring instantiates the model beans: the
 * environment is a singleton that cannot be reconfigured after first creation. Properties are read
 * from the {@link Environment} because configuration-properties binding is not available this
 * early.
 *
 * <ul>
 *   <li>{@code lexsearch.onnx.spinning} - thread spinning (default off, reduces idle CPU)
 *   <li>{@code lexsearch.onnx.intra-op-threads} - parallelism within one inference (default 4)
 *   <li>{@code lexsearch.onnx.inter-op-threads} - parallelism across inferences (default 2)
 * </ul>
 *
 * <p>Skipped entirely when neither model strategy uses ONNX.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private Environment environment;

  @Override
  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    if (!usesOnnx(environment)) {
      log.debug("No ONNX model strategy configured; ONNX Runtime left uninitialised");
      return;
    }
    boolean spinning = environment.getProperty("lexsearch.onnx.spinning", Boolean.class, false);
    int intraOp = environment.getProperty("lexsearch.onnx.intra-op-threads", Integer.class, 4);
    int interOp = environment.getProperty("lexsearch.onnx.inter-op-threads", Integer.class, 2);

    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(spinning);
      threadingOptions.setGlobalIntraOpNumThreads(intraOp);
      threadingOptions.setGlobalInterOpNumThreads(interOp);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "lexsearch", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning={}, intra-op={}, inter-op={}",
          spinning ? "on" : "off",
          intraOp,
          interOp);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }

  static boolean usesOnnx(Environment environment) {
    String embedding = environment.getProperty("lexsearch.models.embedding.strategy", "ONNX");
    String reranker =
        environment.getProperty("lexsearch.models.reranker.strategy", "CROSS_ENCODER");
    return "ONNX".equalsIgnoreCase(embedding) || "CROSS_ENCODER".equalsIgnoreCase(reranker);
  }
}
