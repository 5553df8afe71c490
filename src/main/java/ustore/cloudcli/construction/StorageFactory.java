package ustore.cloudcli.construction;

import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.implementation.AmazonS3Storage;
import ustore.cloudcli.implementation.AzureBlobStorage;
import ustore.cloudcli.implementation.HdfsStorage;
import ustore.cloudcli.implementation.LocalStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.interfaces.InternalStorageInterface;

/**
 * Allows to instantiate the storage backend selected by an effective configuration.
 * A new backend is one more {@link ustore.cloudcli.config.Provider} constant and one more case here.
 * 
 * <p>
 * <p>
 * <h4>Implementation notes:</h4>
 * <ul>
 * <li>Uses the <a href="https://en.wikipedia.org/wiki/Singleton_pattern">Singleton</a> design pattern.</li>
 * </ul>
 * <p>
 */
public class StorageFactory 
{
	private static StorageFactory instance = null;	
	private StorageFactory() {}
	
	public static synchronized StorageFactory getInstance() 
	{ 
		if(instance == null) { instance = new StorageFactory(); }
		return instance;
	}
	
	protected InternalStorageInterface createConnector(EffectiveConfig cfg)
	{
		switch(cfg.getProvider())
		{
		case OSS:
		case S3:
		case MINIO:
		case COS:
			return new AmazonS3Storage(cfg);
		case FS:
			return new LocalStorage(cfg.getRootPath());
		case HDFS:
			return new HdfsStorage(cfg);
		case AZBLOB:
			return new AzureBlobStorage(cfg);
		default:
			throw new IllegalStateException("no connector for " + cfg.getProvider());
		}
	}
	
	/** Builds and connects the storage for one invocation. */
	public ExternalStorageInterface createStorage(EffectiveConfig cfg)
	{
		ExternalStorageInterface ret = new StorageAdapter(createConnector(cfg), cfg.secrets());
		ret.connect();
		return ret;
	}
}
