package msgbus.spring.boot;

import msgbus.AsyncMessageHandler;
import msgbus.MessageBus;
import msgbus.MessageHandler;
import msgbus.MessageType;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Scans for beans annotated with {@link BusSubscriber} and subscribes them to the
 * {@link MessageBus}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see BusSubscriber
 */
public class BusSubscriberRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final MessageBus bus;

    public BusSubscriberRegistrar(ListableBeanFactory beanFactory, MessageBus bus) {
        this.beanFactory = beanFactory;
        this.bus = bus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(BusSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            BusSubscriber annotation = bean.getClass().getAnnotation(BusSubscriber.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), BusSubscriber.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @BusSubscriber annotation on " + bean.getClass().getName());
            }

            int typeCode = resolveTypeCode(beanName, annotation);

            if (bean instanceof MessageHandler handler) {
                bus.subscribe(typeCode, handler, null, annotation.minPriority());
            } else if (bean instanceof AsyncMessageHandler handler) {
                bus.subscribeAsync(typeCode, handler, null, annotation.minPriority());
            } else {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @BusSubscriber must implement MessageHandler or "
                                + "AsyncMessageHandler, but " + bean.getClass().getName() + " does not");
            }
        }
    }

    private int resolveTypeCode(String beanName, BusSubscriber annotation) {
        Class<? extends MessageType> typeClass = annotation.typeClass();
        if (typeClass != MessageType.class) {
            MessageType type = instantiate(beanName, typeClass);
            bus.registerType(type);
            return type.code();
        }
        String name = annotation.type();
        if (!name.isEmpty()) {
            OptionalInt code = bus.types().codeOf(name);
            if (code.isEmpty()) {
                throw new BeanCreationException(beanName,
                        "@BusSubscriber type '" + name + "' is not registered");
            }
            return code.getAsInt();
        }
        if (annotation.code() < 0) {
            throw new BeanCreationException(beanName,
                    "@BusSubscriber must specify one of code, type or typeClass");
        }
        return annotation.code();
    }

    private MessageType instantiate(String beanName, Class<? extends MessageType> clazz) {
        try {
            if (clazz.isEnum()) {
                MessageType[] constants = clazz.getEnumConstants();
                if (constants == null || constants.length == 0) {
                    throw new BeanCreationException(beanName,
                            "@BusSubscriber typeClass enum " + clazz.getName() + " has no constants");
                }
                return constants[0];
            }
            return clazz.getDeclaredConstructor().newInstance();
        } catch (BeanCreationException e) {
            throw e;
        } catch (Exception e) {
            throw new BeanCreationException(beanName,
                    "Failed to instantiate @BusSubscriber typeClass: " + clazz.getName(), e);
        }
    }
}
