package pmc;

import com.google.common.eventbus.EventBus;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import pmc.dal.CloudConfig;
import pmc.dal.ConfigurationService;
import pmc.dal.JsonJobStore;
import pmc.dal.MonitorConfig;
import pmc.dal.ReservationStore;
import pmc.dal.ServerConfig;
import pmc.dal.StorageConfig;
import pmc.dal.TransferConfig;
import pmc.domain.cloud.CloudControlClient;
import pmc.domain.cloud.CloudHttpClient;
import pmc.domain.cloud.EventReporter;
import pmc.domain.cloud.HeartbeatService;
import pmc.domain.cloud.StatusReporter;
import pmc.domain.command.CommandExecutor;
import pmc.domain.command.ICommandQueue;
import pmc.domain.completion.CompletionMonitor;
import pmc.domain.device.ControlSequence;
import pmc.domain.device.DefaultDeviceFactory;
import pmc.domain.device.IDeviceFactory;
import pmc.domain.hms.HmsTracker;
import pmc.domain.jobs.IJobStore;
import pmc.domain.jobs.JobTracker;
import pmc.domain.start.PrintStartProtocol;
import pmc.domain.status.SnapshotNormalizer;
import pmc.domain.transfer.UploadProtocol;

import javax.inject.Singleton;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 17/10/2026
 */
public class GuiceModule extends AbstractModule {
    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        bind(ConfigurationService.class).toInstance(configService);
        bind(CloudConfig.class).toInstance(configService.getCloudConfiguration());
        bind(MonitorConfig.class).toInstance(configService.getMonitorConfiguration());
        bind(TransferConfig.class).toInstance(configService.getTransferConfiguration());
        bind(StorageConfig.class).toInstance(configService.getStorageConfiguration());
        bind(ServerConfig.class).toInstance(configService.getServerConfiguration());

        bind(EventBus.class).toInstance(new EventBus("pmc"));
        bind(IDeviceFactory.class).to(DefaultDeviceFactory.class).in(Singleton.class);
        bind(SnapshotNormalizer.class).in(Singleton.class);
        bind(HmsTracker.class).in(Singleton.class);
        bind(ControlSequence.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public Gson provideGson() {
        return new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    }

    @Provides
    @Singleton
    public CloseableHttpClient provideHttpClient(CloudConfig cloudConfig) {
        Timeout timeout = Timeout.ofSeconds(cloudConfig.connectTimeoutSec());
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(timeout)
                                .setSocketTimeout(timeout)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom().setResponseTimeout(timeout).build())
                .build();
    }

    @Provides
    @Singleton
    public CloudHttpClient provideCloudHttpClient(CloudConfig cloudConfig, CloseableHttpClient httpClient, Gson gson) {
        return new CloudHttpClient(cloudConfig, httpClient, gson);
    }

    @Provides
    @Singleton
    public ICommandQueue provideCommandQueue(CloudHttpClient http, Gson gson) {
        return new CloudControlClient(http, gson);
    }

    @Provides
    @Singleton
    public ReservationStore provideReservationStore(StorageConfig storage, Gson gson) {
        ReservationStore store = new ReservationStore(storage.commandCachePath(), gson);
        store.load();
        return store;
    }

    @Provides
    @Singleton
    public IJobStore provideJobStore(StorageConfig storage, Gson gson) {
        return new JsonJobStore(storage.jobStorePath(), gson);
    }

    @Provides
    @Singleton
    public JobTracker provideJobTracker(IJobStore store) {
        return new JobTracker(store);
    }

    @Provides
    @Singleton
    public CompletionMonitor provideCompletionMonitor(MonitorConfig monitor) {
        return new CompletionMonitor(monitor.completionDebounce());
    }

    @Provides
    @Singleton
    public CommandExecutor provideCommandExecutor(ControlSequence sequence) {
        return new CommandExecutor(sequence);
    }

    @Provides
    @Singleton
    public UploadProtocol provideUploadProtocol(TransferConfig transfer, CloudConfig cloudConfig) {
        return new UploadProtocol(transfer, cloudConfig.connectTimeoutSec());
    }

    @Provides
    @Singleton
    public PrintStartProtocol providePrintStartProtocol(MonitorConfig monitor, SnapshotNormalizer normalizer, ControlSequence sequence) {
        return new PrintStartProtocol(monitor, normalizer, sequence);
    }

    @Provides
    @Singleton
    public EventReporter provideEventReporter(CloudHttpClient http, JobTracker jobTracker) {
        return new EventReporter(http, jobTracker);
    }

    @Provides
    @Singleton
    public HeartbeatService provideHeartbeatService(CloudHttpClient http, EventReporter eventReporter) {
        return new HeartbeatService(http, eventReporter);
    }

    @Provides
    @Singleton
    public StatusReporter provideStatusReporter(CloudHttpClient http) {
        return new StatusReporter(http);
    }
}
