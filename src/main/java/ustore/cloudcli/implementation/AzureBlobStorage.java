package ustore.cloudcli.implementation;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobItemProperties;
import com.azure.storage.blob.models.BlobProperties;
import com.azure.storage.blob.models.BlobRange;
import com.azure.storage.blob.models.ListBlobsOptions;
import com.azure.storage.blob.specialized.BlockBlobClient;
import com.azure.storage.common.StorageSharedKeyCredential;
import com.google.common.base.Function;
import com.google.common.collect.Iterators;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.ObjectKeyIterator.ObjectRecord;
import ustore.cloudcli.interfaces.InternalStorageInterface;

/**
 * Implements a storage backend for an Azure Blob Storage container.
 * <p><p>
 * Writes stage blocks and commit the block list on close; uncommitted blocks are never visible.
 */
public class AzureBlobStorage implements InternalStorageInterface 
{
	private Log log = Log.getInstance();
	private SystemParameters sysParams = SystemParameters.getInstance();
	
	private final EffectiveConfig config;
	private BlobContainerClient container = null;
	
	public AzureBlobStorage(EffectiveConfig cfg) { config = cfg; }
	
	@Override
	public void connect() 
	{
		String account = config.getAccessKeyId();
		String endpoint = config.getEndpoint() != null ? config.getEndpoint() : "https://" + account + ".blob.core.windows.net";
		container = new BlobServiceClientBuilder()
				.endpoint(endpoint)
				.credential(new StorageSharedKeyCredential(account, config.getAccessKeySecret()))
				.buildClient()
				.getBlobContainerClient(config.getBucket());
		log.append("[AZ] using container " + config.getBucket() + " at " + endpoint, Log.TRACE);
	}
	
	@Override
	public Capabilities getCapabilities() { return new Capabilities(true, false, false, false, true); }

	@Override
	public Entry stat(VirtualPath path) 
	{
		if(path.isRoot() == true) { return Entry.directory(path); }
		
		if(path.isDirectory() == false)
		{
			BlobClient blob = container.getBlobClient(path.getKey());
			if(blob.exists() == true)
			{
				BlobProperties p = blob.getProperties();
				return new Entry(path, EntryKind.FILE, p.getBlobSize(), 
						p.getLastModified() == null ? null : p.getLastModified().toInstant(), p.getETag(), p.getContentType());
			}
		}
		
		ListBlobsOptions opts = new ListBlobsOptions().setPrefix(path.getKey() + "/").setMaxResultsPerPage(1);
		Iterator<BlobItem> it = container.listBlobs(opts, null).iterator();
		return it.hasNext() ? Entry.directory(path) : null;
	}

	@Override
	public Iterator<Entry> list(VirtualPath dir, boolean recursive) 
	{
		ListBlobsOptions opts = new ListBlobsOptions().setPrefix(dir.asDirectory().getObjectKey());
		Iterator<BlobItem> items = (recursive == true) 
				? container.listBlobs(opts, null).iterator()
				: container.listBlobsByHierarchy("/", opts, null).iterator();
		
		Iterator<ObjectRecord> records = Iterators.transform(items, new Function<BlobItem, ObjectRecord>()
		{
			@Override
			public ObjectRecord apply(BlobItem item) 
			{
				if(Boolean.TRUE.equals(item.isPrefix()) == true) { return new ObjectRecord(item.getName(), 0, null, null); }
				BlobItemProperties p = item.getProperties();
				long size = (p == null || p.getContentLength() == null) ? 0 : p.getContentLength();
				return new ObjectRecord(item.getName(), size, 
						(p == null || p.getLastModified() == null) ? null : p.getLastModified().toInstant(), p == null ? null : p.getETag());
			}
		});
		return new ObjectKeyIterator(records, dir, recursive);
	}

	@Override
	public InputStream openRead(VirtualPath path, ByteRange range) 
	{
		BlobClient blob = container.getBlobClient(path.getKey());
		if(range == null) { return blob.openInputStream(); }
		if(range.isOpenEnded() == false && range.getLength() == 0) { return new ByteArrayInputStream(new byte[0]); }
		BlobRange r = range.isOpenEnded() ? new BlobRange(range.getOffset()) : new BlobRange(range.getOffset(), range.getLength());
		return blob.openInputStream(r, null);
	}

	@Override
	public ObjectSink openWrite(VirtualPath path) 
	{
		final BlockBlobClient blob = container.getBlobClient(path.getKey()).getBlockBlobClient();
		final int blockSize = Math.max(sysParams.chunkSize, 4 * 1024 * 1024);
		return new ObjectSink()
		{
			private final List<String> blockIds = new ArrayList<String>();
			private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
			private boolean finished = false;
			
			@Override
			public void write(byte[] b, int off, int len) throws IOException
			{
				buffer.write(b, off, len);
				if(buffer.size() >= blockSize) { stage(); }
			}
			
			private void stage()
			{
				byte[] data = buffer.toByteArray();
				buffer.reset();
				String id = Base64.getEncoder().encodeToString(UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8));
				blob.stageBlock(id, new ByteArrayInputStream(data), data.length);
				blockIds.add(id);
			}
			
			@Override
			public void close() 
			{
				if(finished == true) { return; }
				finished = true;
				if(buffer.size() > 0 || blockIds.isEmpty() == true) { stage(); }
				blob.commitBlockList(blockIds, true);
			}
			
			@Override
			public void abort() { finished = true; }
		};
	}
	
	@Override
	public ObjectSink openAppend(VirtualPath path) 
	{
		throw new UnsupportedOperationException("block blobs have no native append");
	}

	@Override
	public void delete(VirtualPath path) 
	{
		BlobClient blob = container.getBlobClient(path.getObjectKey());
		if(path.isDirectory() == true) { blob.deleteIfExists(); }
		else { blob.delete(); }
	}

	@Override
	public void createDirectory(VirtualPath path, boolean recursive) 
	{
		if(path.isRoot() == true) { return; }
		container.getBlobClient(path.asDirectory().getObjectKey()).getBlockBlobClient().upload(new ByteArrayInputStream(new byte[0]), 0, true);
	}

	@Override
	public void copy(VirtualPath src, VirtualPath dst) 
	{
		BlobClient from = container.getBlobClient(src.getKey());
		container.getBlobClient(dst.getKey()).beginCopy(from.getBlobUrl(), Duration.ofSeconds(1)).waitForCompletion();
	}

	@Override
	public void rename(VirtualPath src, VirtualPath dst) 
	{
		throw new UnsupportedOperationException("blob storage has no native rename");
	}

	@Override
	public void disconnect() {}
	
	@Override
	public String getName() { return "azblob://" + config.getBucket(); }
}
